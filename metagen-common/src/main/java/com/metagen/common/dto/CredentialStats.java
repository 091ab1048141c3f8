package com.metagen.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 单个凭证的只读快照，供宿主展示与持久化。不包含完整密钥。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialStats {

    /** 凭证唯一标识 */
    private String id;

    /** 用户可读名称，如 "Credential 1" */
    private String displayName;

    /** 脱敏后的密钥，仅保留首尾各 4 位 */
    private String maskedSecret;

    /** 校验状态 */
    private CredentialState state;

    /** 累计请求次数（含失败的请求） */
    private long requestCount;

    /** 最近一次请求时间 */
    private Instant lastRequestAt;

    /** 最近一次错误信息 */
    private String lastError;

    /** 添加时间 */
    private Instant createdAt;

    /** 当前滑动窗口内的请求数 */
    private int requestsInWindow;

    /** 当前窗口剩余可用请求数 */
    private int remainingQuota;

    /** 窗口内最早一条记录过期的时间；有余量时为 null */
    private Instant nextAvailableAt;

    /** 是否有任务正在使用该凭证 */
    private boolean inFlight;

    /** 已请求移除，等待当前任务结束 */
    private boolean removalPending;
}
