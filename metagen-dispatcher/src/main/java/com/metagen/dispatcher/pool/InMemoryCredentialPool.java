package com.metagen.dispatcher.pool;

import com.metagen.common.dto.CredentialState;
import com.metagen.common.dto.CredentialStats;
import com.metagen.common.util.IdGenerator;
import com.metagen.dispatcher.ratelimit.RateWindow;
import com.metagen.dispatcher.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 基于内存的凭证池。
 * <p>
 * 所有读写都在同一把锁内完成（单写者语义），监听器回调在锁外触发。
 */
@Slf4j
public class InMemoryCredentialPool implements CredentialPool {

    /** 最久未使用优先；从未使用的最先，其次按加入顺序 */
    private static final Comparator<CredentialRecord> LEAST_RECENTLY_USED = Comparator
            .comparing(CredentialRecord::getLastRequestAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(CredentialRecord::getSequence);

    private final Object lock = new Object();
    private final Map<String, CredentialRecord> credentials = new LinkedHashMap<>();
    private final List<CredentialPoolListener> listeners = new CopyOnWriteArrayList<>();
    private final Duration window;
    private final Clock clock;

    /** 配置的容量，没有运行进行时生效 */
    private final int configuredCapacity;

    /** 进行中的各运行登记的容量 */
    private final List<Integer> runCapacities = new ArrayList<>();

    private int capacityPerWindow;
    private long sequence;

    public InMemoryCredentialPool(int capacityPerWindow, Duration window, Clock clock) {
        this.configuredCapacity = capacityPerWindow;
        this.capacityPerWindow = capacityPerWindow;
        this.window = window;
        this.clock = clock;
    }

    @Override
    public CredentialStats add(String secret, String displayName) {
        if (secret == null) {
            throw new IllegalArgumentException("secret 不能为空");
        }
        CredentialStats added;
        synchronized (lock) {
            sequence++;
            String name = displayName == null || displayName.isBlank()
                    ? "Credential " + sequence
                    : displayName.trim();
            Instant now = clock.instant();
            CredentialRecord record = new CredentialRecord(IdGenerator.credentialId(), secret.trim(), name,
                    now, new RateWindow(capacityPerWindow, window), sequence);
            credentials.put(record.getId(), record);
            added = record.toStats(now);
        }
        log.info("添加新凭证到池: {} ({})", added.getDisplayName(), added.getMaskedSecret());
        fireChanged(added);
        return added;
    }

    @Override
    public boolean remove(String id) {
        synchronized (lock) {
            CredentialRecord record = credentials.get(id);
            if (record == null) {
                return false;
            }
            if (record.isOccupied()) {
                record.markRemovalPending();
                log.info("凭证 {} 有在途任务，待任务结束后移除", record.getDisplayName());
                return true;
            }
            credentials.remove(id);
            log.info("移除凭证: {}", record.getDisplayName());
        }
        fireRemoved(id);
        return true;
    }

    @Override
    public Optional<CredentialStats> find(String id, Instant now) {
        synchronized (lock) {
            return Optional.ofNullable(credentials.get(id)).map(r -> r.toStats(now));
        }
    }

    @Override
    public List<CredentialStats> eligible(Instant now) {
        synchronized (lock) {
            return credentials.values().stream()
                    .filter(r -> r.isEligible(now))
                    .sorted(LEAST_RECENTLY_USED)
                    .map(r -> r.toStats(now))
                    .toList();
        }
    }

    @Override
    public Optional<CredentialLease> tryAcquire(Instant now) {
        CredentialRecord chosen;
        CredentialStats stats;
        synchronized (lock) {
            chosen = credentials.values().stream()
                    .filter(r -> r.isEligible(now))
                    .min(LEAST_RECENTLY_USED)
                    .orElse(null);
            if (chosen == null) {
                return Optional.empty();
            }
            chosen.occupy(now);
            stats = chosen.toStats(now);
        }
        log.debug("借出凭证: {} ({}), 窗口内 {}/{}", chosen.getDisplayName(), stats.getMaskedSecret(),
                stats.getRequestsInWindow(), chosen.getRateWindow().getCapacity());
        fireChanged(stats);
        return Optional.of(new CredentialLease(chosen.getId(), chosen.getSecret(), chosen.getDisplayName(), now));
    }

    @Override
    public void recordAttempt(String id, AttemptOutcome outcome, String error, Instant now) {
        CredentialStats changed;
        boolean removed = false;
        synchronized (lock) {
            CredentialRecord record = credentials.get(id);
            if (record == null) {
                log.warn("归还未知凭证: {}", id);
                return;
            }
            record.release();
            switch (outcome) {
                case SUCCEEDED -> record.setLastError(null);
                case TRANSIENT_FAILURE -> record.setLastError(error);
                case QUOTA_EXCEEDED -> {
                    record.setLastError(error);
                    record.getRateWindow().markExhausted(now);
                    log.warn("凭证 {} 服务端配额超限，暂停使用至 {}", record.getDisplayName(),
                            record.getRateWindow().nextAvailableAt(now));
                }
                case AUTHENTICATION_FAILED -> {
                    record.setLastError(error);
                    if (record.getState() == CredentialState.VALID) {
                        record.transitionTo(CredentialState.INVALID);
                        log.warn("凭证 {} 认证失败，本次运行不再使用: {}", record.getDisplayName(), error);
                    }
                }
                case JOB_REJECTED -> {
                    // 错在输入，凭证不受影响
                }
            }
            changed = record.toStats(now);
            if (record.isRemovalPending()) {
                credentials.remove(id);
                removed = true;
                log.info("在途任务已结束，移除凭证: {}", record.getDisplayName());
            }
        }
        if (removed) {
            fireRemoved(id);
        } else {
            fireChanged(changed);
        }
    }

    @Override
    public Optional<String> beginValidation(String id) {
        CredentialStats changed;
        String secret;
        synchronized (lock) {
            CredentialRecord record = credentials.get(id);
            if (record == null || record.getState() != CredentialState.UNVALIDATED) {
                return Optional.empty();
            }
            record.transitionTo(CredentialState.VALIDATING);
            secret = record.getSecret();
            changed = record.toStats(clock.instant());
        }
        fireChanged(changed);
        return Optional.of(secret);
    }

    @Override
    public Optional<CredentialStats> applyValidation(String id, ValidationResult result) {
        CredentialStats changed;
        synchronized (lock) {
            CredentialRecord record = credentials.get(id);
            if (record == null) {
                return Optional.empty();
            }
            if (record.getState() != CredentialState.VALIDATING) {
                log.debug("凭证 {} 当前状态为 {}，忽略校验结果", record.getDisplayName(), record.getState());
                return Optional.of(record.toStats(clock.instant()));
            }
            if (result.isValid()) {
                record.transitionTo(CredentialState.VALID);
                record.setLastError(null);
                log.info("凭证 {} 校验通过", record.getDisplayName());
            } else {
                record.transitionTo(CredentialState.INVALID);
                record.setLastError(result.getError());
                log.warn("凭证 {} 校验失败: {}", record.getDisplayName(), result.getError());
            }
            changed = record.toStats(clock.instant());
        }
        fireChanged(changed);
        return Optional.of(changed);
    }

    @Override
    public List<String> unvalidatedIds() {
        synchronized (lock) {
            return credentials.values().stream()
                    .filter(r -> r.getState() == CredentialState.UNVALIDATED && !r.isRemovalPending())
                    .map(CredentialRecord::getId)
                    .toList();
        }
    }

    @Override
    public boolean allInvalid() {
        synchronized (lock) {
            return credentials.values().stream()
                    .allMatch(r -> r.getState() == CredentialState.INVALID || r.isRemovalPending());
        }
    }

    @Override
    public void claimRunCapacity(int capacityPerWindow) {
        if (capacityPerWindow < 1) {
            throw new IllegalArgumentException("单凭证容量至少为 1: " + capacityPerWindow);
        }
        synchronized (lock) {
            runCapacities.add(capacityPerWindow);
            applyEffectiveCapacity();
        }
    }

    @Override
    public void releaseRunCapacity(int capacityPerWindow) {
        synchronized (lock) {
            runCapacities.remove(Integer.valueOf(capacityPerWindow));
            applyEffectiveCapacity();
        }
    }

    /** 有运行进行时取最小的登记容量，否则恢复配置值 */
    private void applyEffectiveCapacity() {
        int effective = runCapacities.stream()
                .mapToInt(Integer::intValue)
                .min()
                .orElse(configuredCapacity);
        if (effective == capacityPerWindow) {
            return;
        }
        for (CredentialRecord record : credentials.values()) {
            record.getRateWindow().setCapacity(effective);
        }
        capacityPerWindow = effective;
        log.info("凭证窗口容量调整为 {}/{}s", effective, window.toSeconds());
    }

    @Override
    public List<CredentialStats> snapshot(Instant now) {
        synchronized (lock) {
            List<CredentialStats> result = new ArrayList<>(credentials.size());
            for (CredentialRecord record : credentials.values()) {
                result.add(record.toStats(now));
            }
            return result;
        }
    }

    @Override
    public void addListener(CredentialPoolListener listener) {
        listeners.add(listener);
    }

    private void fireChanged(CredentialStats stats) {
        for (CredentialPoolListener listener : listeners) {
            try {
                listener.onCredentialStateChanged(stats);
            } catch (RuntimeException e) {
                log.error("凭证变更回调异常: {}", stats.getDisplayName(), e);
            }
        }
    }

    private void fireRemoved(String id) {
        for (CredentialPoolListener listener : listeners) {
            try {
                listener.onCredentialRemoved(id);
            } catch (RuntimeException e) {
                log.error("凭证移除回调异常: {}", id, e);
            }
        }
    }
}
