package com.metagen.dispatcher.service;

import com.metagen.common.dto.CredentialStats;
import com.metagen.common.dto.JobOutcome;
import com.metagen.common.dto.RunProgress;
import com.metagen.common.dto.RunReport;
import com.metagen.common.dto.RunStatus;
import com.metagen.dispatcher.job.GenerationJob;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 汇总任务结果并对外发布实时进度。
 * <p>
 * 只做被动观察，不参与调度决策；任务可以按任意顺序结束。
 */
@Slf4j
public class ResultAggregator<R> {

    private final String runId;
    private final int total;
    private final List<JobOutcome<R>> succeeded = new ArrayList<>();
    private final List<JobOutcome<R>> failed = new ArrayList<>();
    private final Set<String> settledJobIds = new HashSet<>();

    /** 新订阅者会先收到最近一次进度 */
    private final Sinks.Many<RunProgress> progressSink = Sinks.many().replay().latest();

    private String currentFile;
    private RunStatus status = RunStatus.IDLE;

    public ResultAggregator(String runId, int total) {
        this.runId = runId;
        this.total = total;
        emit();
    }

    public synchronized void onRunStatus(RunStatus status) {
        this.status = status;
        emit();
    }

    public synchronized void onJobDispatched(GenerationJob<?, R> job) {
        this.currentFile = job.getFileReference();
        emit();
    }

    /**
     * 记录一个已结束的任务。同一任务只能结算一次。
     */
    public synchronized void onJobSettled(GenerationJob<?, R> job) {
        if (!settledJobIds.add(job.getId())) {
            throw new IllegalStateException("任务重复结算: " + job.getId());
        }
        JobOutcome<R> outcome = job.toOutcome();
        if (outcome.isSucceeded()) {
            succeeded.add(outcome);
        } else {
            failed.add(outcome);
            log.warn("任务 {} ({}) 失败: {}", job.getId(), job.getFileReference(), outcome.getFailureReason());
        }

        int done = settledJobIds.size();
        // 每完成一定数量或最后一个时打印进度
        if (done % 5 == 0 || done == total) {
            log.info("生成进度: {}/{} (成功 {})", done, total, succeeded.size());
        }
        emit();
    }

    public synchronized RunProgress currentProgress() {
        return RunProgress.builder()
                .runId(runId)
                .completed(settledJobIds.size())
                .total(total)
                .succeeded(succeeded.size())
                .failed(failed.size())
                .currentFile(currentFile)
                .status(status)
                .build();
    }

    public Flux<RunProgress> progress() {
        return progressSink.asFlux();
    }

    /**
     * 生成最终报告并结束进度流。
     */
    public synchronized RunReport<R> report(RunStatus finalStatus, List<CredentialStats> credentialStats,
                                            Instant startedAt, Instant finishedAt) {
        this.status = finalStatus;
        emit();
        progressSink.tryEmitComplete();
        return RunReport.<R>builder()
                .runId(runId)
                .status(finalStatus)
                .succeeded(List.copyOf(succeeded))
                .failed(List.copyOf(failed))
                .credentialStats(credentialStats)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }

    private void emit() {
        Sinks.EmitResult result = progressSink.tryEmitNext(currentProgress());
        if (result.isFailure()) {
            log.debug("进度推送失败: {}", result);
        }
    }
}
