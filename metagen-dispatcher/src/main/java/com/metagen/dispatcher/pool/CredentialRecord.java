package com.metagen.dispatcher.pool;

import com.metagen.common.dto.CredentialState;
import com.metagen.common.dto.CredentialStats;
import com.metagen.common.util.SecretMasker;
import com.metagen.dispatcher.ratelimit.RateWindow;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;

/**
 * 单个凭证的身份、校验状态、用量统计及其滑动窗口。
 * <p>
 * 由 {@link CredentialPool} 独占，所有修改都在池锁内进行。
 */
@Getter
public class CredentialRecord {

    private final String id;

    @Getter(AccessLevel.PACKAGE)
    private final String secret;

    private final String displayName;
    private final Instant createdAt;
    private final RateWindow rateWindow;

    /** 加入池的顺序，lastRequestAt 相同时的次级排序键 */
    private final long sequence;

    private CredentialState state = CredentialState.UNVALIDATED;
    private long requestCount;
    private Instant lastRequestAt;
    private String lastError;

    /** 是否有任务正在使用（每个凭证同一时刻最多一个在途任务） */
    private boolean occupied;

    /** 已请求移除，等待在途任务结束 */
    private boolean removalPending;

    CredentialRecord(String id, String secret, String displayName, Instant createdAt,
                     RateWindow rateWindow, long sequence) {
        this.id = id;
        this.secret = secret;
        this.displayName = displayName;
        this.createdAt = createdAt;
        this.rateWindow = rateWindow;
        this.sequence = sequence;
    }

    /**
     * 状态迁移，非法迁移抛出 {@link IllegalStateException}。
     */
    void transitionTo(CredentialState target) {
        boolean allowed = switch (state) {
            case UNVALIDATED -> target == CredentialState.VALIDATING;
            case VALIDATING -> target == CredentialState.VALID || target == CredentialState.INVALID;
            case VALID -> target == CredentialState.INVALID;
            case INVALID -> false;
        };
        if (!allowed) {
            throw new IllegalStateException("凭证 " + displayName + " 不能从 " + state + " 迁移到 " + target);
        }
        this.state = target;
    }

    /**
     * 能否立即接收新任务：VALID、空闲、未待移除且窗口有余量。
     */
    boolean isEligible(Instant now) {
        return state == CredentialState.VALID
                && !occupied
                && !removalPending
                && rateWindow.hasCapacity(now);
    }

    void occupy(Instant now) {
        if (occupied) {
            throw new IllegalStateException("凭证 " + displayName + " 已有在途任务");
        }
        occupied = true;
        requestCount++;
        lastRequestAt = now;
        rateWindow.recordRequest(now);
    }

    void release() {
        occupied = false;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    void markRemovalPending() {
        this.removalPending = true;
    }

    CredentialStats toStats(Instant now) {
        boolean full = !rateWindow.hasCapacity(now);
        return CredentialStats.builder()
                .id(id)
                .displayName(displayName)
                .maskedSecret(SecretMasker.mask(secret))
                .state(state)
                .requestCount(requestCount)
                .lastRequestAt(lastRequestAt)
                .lastError(lastError)
                .createdAt(createdAt)
                .requestsInWindow(rateWindow.countInWindow(now))
                .remainingQuota(rateWindow.remainingQuota(now))
                .nextAvailableAt(full ? rateWindow.nextAvailableAt(now) : null)
                .inFlight(occupied)
                .removalPending(removalPending)
                .build();
    }
}
