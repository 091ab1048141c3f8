package com.metagen.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 一次批量运行的最终报告：每个任务恰好出现在 succeeded 或 failed 之一。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunReport<R> {

    private String runId;

    private RunStatus status;

    private List<JobOutcome<R>> succeeded;

    private List<JobOutcome<R>> failed;

    /** 运行结束时各凭证的使用统计 */
    private List<CredentialStats> credentialStats;

    private Instant startedAt;

    private Instant finishedAt;

    public int totalJobs() {
        return size(succeeded) + size(failed);
    }

    public Duration elapsed() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    private static int size(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
