package com.metagen.dispatcher.pool;

import com.metagen.common.dto.CredentialStats;
import com.metagen.dispatcher.validation.ValidationResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 凭证池接口。
 * <p>
 * 多个异步任务的完成回调会同时更新同一个池，因此所有修改以及用于分配的读取
 * 都必须串行化，保证同一凭证不会被同时分配给两个任务。
 */
public interface CredentialPool {

    /** 添加一个凭证，初始状态为 UNVALIDATED；名称为空时自动命名 */
    CredentialStats add(String secret, String displayName);

    /**
     * 移除凭证。凭证有在途任务时延迟到该任务结束后再移除。
     *
     * @return 凭证不存在时返回 false
     */
    boolean remove(String id);

    Optional<CredentialStats> find(String id, Instant now);

    /**
     * 当前可接收任务的凭证，按最久未使用优先排序（从未使用的排在最前）。
     */
    List<CredentialStats> eligible(Instant now);

    /**
     * 原子地选出最久未使用的可用凭证并借出：标记占用、计入滑动窗口、
     * 累加 requestCount 并更新 lastRequestAt。
     *
     * @return 没有可用凭证时为空
     */
    Optional<CredentialLease> tryAcquire(Instant now);

    /**
     * 归还借出的凭证并应用本次调用结果对凭证的影响。
     *
     * @param error 失败时的错误信息，成功时为 null
     */
    void recordAttempt(String id, AttemptOutcome outcome, String error, Instant now);

    /**
     * UNVALIDATED → VALIDATING。
     *
     * @return 迁移成功时返回密钥，供探测使用；凭证不存在或已在校验时为空
     */
    Optional<String> beginValidation(String id);

    /**
     * 应用校验结果：VALIDATING → VALID / INVALID。
     *
     * @return 凭证已被移除时为空
     */
    Optional<CredentialStats> applyValidation(String id, ValidationResult result);

    /** 尚未校验的凭证 ID */
    List<String> unvalidatedIds();

    /**
     * 是否已没有任何凭证可能再变为可用（全部 INVALID、待移除，或池为空）。
     */
    boolean allInvalid();

    /**
     * 登记一次运行的单凭证容量。多个运行同时进行时，所有凭证（包括之后新增的）
     * 按其中最小的容量限流。
     */
    void claimRunCapacity(int capacityPerWindow);

    /** 注销运行登记的容量；最后一个运行结束后恢复为配置的容量 */
    void releaseRunCapacity(int capacityPerWindow);

    List<CredentialStats> snapshot(Instant now);

    void addListener(CredentialPoolListener listener);
}
