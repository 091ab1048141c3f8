package com.metagen.dispatcher.validation;

import com.metagen.common.dto.CredentialStats;
import com.metagen.common.exception.CredentialNotFoundException;
import com.metagen.dispatcher.pool.CredentialPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 驱动凭证走完 UNVALIDATED → VALIDATING → VALID/INVALID：
 * 从池中领取待校验凭证，交给 {@link CredentialValidator}，再把结论写回池。
 * <p>
 * 同一凭证被并发激活时只发起一次探测，所有调用方拿到同一个结果。
 */
@Slf4j
@RequiredArgsConstructor
public class CredentialActivator {

    private final CredentialPool pool;
    private final CredentialValidator validator;
    private final Clock clock;

    /** 正在校验的凭证 → 校验结果 */
    private final Map<String, CompletableFuture<CredentialStats>> inProgress = new ConcurrentHashMap<>();

    /**
     * 校验单个凭证。正在校验时返回同一个结果；已有结论时直接返回当前快照。
     *
     * @return 校验后的快照（VALID 或 INVALID）；凭证被移除时以 {@link CredentialNotFoundException} 完成
     */
    public CompletableFuture<CredentialStats> activate(String credentialId) {
        CompletableFuture<CredentialStats> future = new CompletableFuture<>();
        CompletableFuture<CredentialStats> running = inProgress.putIfAbsent(credentialId, future);
        if (running != null) {
            return running;
        }

        Optional<String> secret = pool.beginValidation(credentialId);
        if (secret.isEmpty()) {
            inProgress.remove(credentialId, future);
            Optional<CredentialStats> current = pool.find(credentialId, clock.instant());
            if (current.isPresent()) {
                future.complete(current.get());
            } else {
                future.completeExceptionally(new CredentialNotFoundException(credentialId));
            }
            return future;
        }

        validator.validate(secret.get()).whenComplete((result, ex) -> {
            inProgress.remove(credentialId, future);
            if (ex != null) {
                future.completeExceptionally(ex);
                return;
            }
            Optional<CredentialStats> applied = pool.applyValidation(credentialId, result);
            if (applied.isPresent()) {
                future.complete(applied.get());
            } else {
                future.completeExceptionally(new CredentialNotFoundException(credentialId));
            }
        });
        return future;
    }

    /**
     * 对池中所有 UNVALIDATED 凭证发起校验，不等待结果。
     *
     * @return 本次发起的校验数
     */
    public int activatePending() {
        List<String> pending = pool.unvalidatedIds();
        for (String id : pending) {
            activate(id).whenComplete((stats, ex) -> {
                if (ex != null) {
                    log.debug("凭证 {} 在校验期间被移除", id);
                }
            });
        }
        return pending.size();
    }
}
