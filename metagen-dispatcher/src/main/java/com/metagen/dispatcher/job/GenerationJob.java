package com.metagen.dispatcher.job;

import com.metagen.common.dto.JobOutcome;
import lombok.Getter;

/**
 * 一个文件的生成任务及其状态机：
 * PENDING → IN_FLIGHT → {SUCCEEDED, FAILED, PENDING（重新排队）}，PENDING → FAILED（无法派发）。
 * <p>
 * 整个生命周期只由调度线程访问。
 */
@Getter
public class GenerationJob<P, R> {

    private final String id;
    private final String fileReference;
    private final P payload;

    private JobState state = JobState.PENDING;

    /** 已派发次数 */
    private int attemptCount;

    /** 瞬时/配额类失败次数，只有这类失败消耗重试额度 */
    private int retryableFailures;

    private String lastCredentialId;
    private R result;
    private String terminalReason;

    public GenerationJob(String id, String fileReference, P payload) {
        this.id = id;
        this.fileReference = fileReference;
        this.payload = payload;
    }

    public void markInFlight(String credentialId) {
        expect(JobState.PENDING);
        state = JobState.IN_FLIGHT;
        attemptCount++;
        lastCredentialId = credentialId;
    }

    public void succeed(R result) {
        expect(JobState.IN_FLIGHT);
        this.result = result;
        state = JobState.SUCCEEDED;
    }

    /**
     * 记一次瞬时/配额类失败。
     *
     * @return 累计的失败次数
     */
    public int countRetryableFailure() {
        expect(JobState.IN_FLIGHT);
        return ++retryableFailures;
    }

    public void requeue() {
        expect(JobState.IN_FLIGHT);
        state = JobState.PENDING;
    }

    public void fail(String reason) {
        if (state != JobState.PENDING && state != JobState.IN_FLIGHT) {
            throw new IllegalStateException("任务 " + id + " 已结束，不能再标记失败: " + state);
        }
        terminalReason = reason;
        state = JobState.FAILED;
    }

    public boolean isTerminal() {
        return state == JobState.SUCCEEDED || state == JobState.FAILED;
    }

    public JobOutcome<R> toOutcome() {
        if (!isTerminal()) {
            throw new IllegalStateException("任务 " + id + " 尚未结束: " + state);
        }
        return JobOutcome.<R>builder()
                .jobId(id)
                .fileReference(fileReference)
                .succeeded(state == JobState.SUCCEEDED)
                .result(result)
                .failureReason(terminalReason)
                .attemptCount(attemptCount)
                .lastCredentialId(lastCredentialId)
                .build();
    }

    private void expect(JobState expected) {
        if (state != expected) {
            throw new IllegalStateException("任务 " + id + " 状态应为 " + expected + "，实际为 " + state);
        }
    }
}
