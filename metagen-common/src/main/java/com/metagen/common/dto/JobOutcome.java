package com.metagen.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个文件任务的最终结果。
 *
 * @param <R> 生成结果类型（对调度器不透明）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobOutcome<R> {

    private String jobId;

    /** 文件引用（通常是文件名） */
    private String fileReference;

    private boolean succeeded;

    /** 成功时的生成结果 */
    private R result;

    /** 失败原因（人类可读） */
    private String failureReason;

    /** 实际派发次数 */
    private int attemptCount;

    /** 最后一次处理该任务的凭证 */
    private String lastCredentialId;
}
