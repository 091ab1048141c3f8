package com.metagen.dispatcher.service;

import com.metagen.common.dto.RunReport;
import com.metagen.common.dto.RunStatus;
import com.metagen.common.exception.ErrorCategory;
import com.metagen.common.exception.MetagenException;
import com.metagen.dispatcher.job.GenerationJob;
import com.metagen.dispatcher.job.JobQueue;
import com.metagen.dispatcher.pool.AttemptOutcome;
import com.metagen.dispatcher.pool.CredentialLease;
import com.metagen.dispatcher.pool.CredentialPool;
import com.metagen.dispatcher.spi.MetadataGenerator;
import com.metagen.dispatcher.validation.CredentialActivator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次批量运行的调度循环。
 * <p>
 * 单个调度线程负责：选凭证、取任务、发起异步生成调用、处理完成事件。
 * 生成调用的完成回调只把结果投递到完成队列，任务状态始终只由调度线程修改；
 * 凭证池的修改通过池自身的串行化接口完成。
 * <p>
 * 状态：IDLE → RUNNING → {DRAINED, CANCELLED}。调度线程异常终止时，
 * 归还在途凭证，未结束的任务全部以 "run aborted: ..." 失败，运行记为 CANCELLED。
 */
@Slf4j
class DispatchRun<P, R> implements Runnable {

    private final String runId;
    private final List<GenerationJob<P, R>> jobs;
    private final JobQueue<P, R> queue;
    private final CredentialPool pool;
    private final CredentialActivator activator;
    private final MetadataGenerator<P, R> generator;
    private final RunOptions options;
    private final Clock clock;
    private final long tickMillis;
    private final ResultAggregator<R> aggregator;

    private final BlockingQueue<Completion<P, R>> completions = new LinkedBlockingQueue<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CompletableFuture<RunReport<R>> result = new CompletableFuture<>();

    /** 在途调用，按任务 ID 索引；只由调度线程访问 */
    private final Map<String, InFlightCall<P, R>> inFlightCalls = new LinkedHashMap<>();

    private volatile RunStatus status = RunStatus.IDLE;
    private boolean interrupted;

    DispatchRun(String runId, List<GenerationJob<P, R>> jobs, CredentialPool pool, CredentialActivator activator,
                MetadataGenerator<P, R> generator, RunOptions options, Clock clock, long tickMillis) {
        this.runId = runId;
        this.jobs = jobs;
        this.queue = new JobQueue<>(jobs);
        this.pool = pool;
        this.activator = activator;
        this.generator = generator;
        this.options = options;
        this.clock = clock;
        this.tickMillis = tickMillis;
        this.aggregator = new ResultAggregator<>(runId, jobs.size());
    }

    @Override
    public void run() {
        int capacity = options.getPerCredentialCapacityPerMinute();
        try {
            pool.claimRunCapacity(capacity);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        RunReport<R> report = null;
        RuntimeException failure = null;
        try {
            report = execute();
        } catch (RuntimeException e) {
            log.error("运行 {} 异常终止", runId, e);
            failure = e;
            try {
                abort(e);
            } catch (RuntimeException abortError) {
                e.addSuppressed(abortError);
            }
        } finally {
            pool.releaseRunCapacity(capacity);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        // 容量恢复之后再完成结果，调用方拿到报告时池已回到配置值
        if (failure != null) {
            result.completeExceptionally(failure);
        } else {
            result.complete(report);
        }
    }

    /** 请求停止：不再派发新任务，在途任务照常完成并计入报告 */
    void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            log.info("运行 {} 收到停止请求", runId);
        }
    }

    boolean isStopRequested() {
        return stopRequested.get();
    }

    String getRunId() {
        return runId;
    }

    RunStatus getStatus() {
        return status;
    }

    ResultAggregator<R> getAggregator() {
        return aggregator;
    }

    CompletableFuture<RunReport<R>> getResult() {
        return result;
    }

    private RunReport<R> execute() {
        Instant startedAt = clock.instant();
        changeStatus(RunStatus.RUNNING);
        log.info("运行 {} 开始: {} 个任务, 最多尝试 {} 次, 单凭证容量 {}/min",
                runId, jobs.size(), options.getMaxRetries(), options.getPerCredentialCapacityPerMinute());

        RunStatus finalStatus;
        while (true) {
            drainCompletions();
            activator.activatePending();

            if (stopRequested.get()) {
                if (inFlightCalls.isEmpty()) {
                    failPending(FailureReasons.RUN_CANCELLED);
                    finalStatus = RunStatus.CANCELLED;
                    break;
                }
                awaitCompletion();
                continue;
            }

            if (queue.isEmpty() && inFlightCalls.isEmpty()) {
                finalStatus = RunStatus.DRAINED;
                break;
            }

            if (!queue.isEmpty() && inFlightCalls.isEmpty() && pool.allInvalid()) {
                log.warn("运行 {} 已没有可用凭证，剩余 {} 个任务标记失败", runId, queue.size());
                failPending(FailureReasons.NO_VALID_CREDENTIAL);
                finalStatus = RunStatus.DRAINED;
                break;
            }

            if (!assignEligible()) {
                awaitCompletion();
            }
        }

        changeStatus(finalStatus);
        RunReport<R> report = aggregator.report(finalStatus, pool.snapshot(clock.instant()),
                startedAt, clock.instant());
        log.info("运行 {} 结束 ({}), 成功: {}/{}, 失败: {}",
                runId, finalStatus, report.getSucceeded().size(), jobs.size(), report.getFailed().size());
        return report;
    }

    /**
     * 给每个当前可用的凭证派发一个任务。
     *
     * @return 是否派发了至少一个任务
     */
    private boolean assignEligible() {
        boolean assigned = false;
        while (!stopRequested.get() && !queue.isEmpty()) {
            Optional<CredentialLease> lease = pool.tryAcquire(clock.instant());
            if (lease.isEmpty()) {
                break;
            }
            dispatch(queue.poll(), lease.get());
            assigned = true;
        }
        return assigned;
    }

    private void dispatch(GenerationJob<P, R> job, CredentialLease lease) {
        inFlightCalls.put(job.getId(), new InFlightCall<>(job, lease, null));
        job.markInFlight(lease.getCredentialId());
        aggregator.onJobDispatched(job);
        log.debug("派发任务 {} ({}) → {} (第 {} 次)",
                job.getId(), job.getFileReference(), lease.getDisplayName(), job.getAttemptCount());

        CompletableFuture<R> call;
        try {
            call = generator.generate(lease.getSecret(), job.getPayload(), options.getGenerationTimeout());
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            call = CompletableFuture.failedFuture(new IllegalStateException("生成器返回了空 Future"));
        }

        CompletableFuture<R> bounded = call.orTimeout(options.getGenerationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        inFlightCalls.put(job.getId(), new InFlightCall<>(job, lease, bounded));
        bounded.whenComplete((value, error) -> completions.offer(new Completion<>(job, lease, value, error)));
    }

    private void awaitCompletion() {
        try {
            Completion<P, R> completion = completions.poll(tickMillis, TimeUnit.MILLISECONDS);
            if (completion != null) {
                apply(completion);
            }
        } catch (InterruptedException e) {
            // 中断视为停止请求，继续等待在途任务结束
            interrupted = true;
            requestStop();
        }
    }

    private void drainCompletions() {
        Completion<P, R> completion;
        while ((completion = completions.poll()) != null) {
            apply(completion);
        }
    }

    private void apply(Completion<P, R> completion) {
        GenerationJob<P, R> job = completion.job();
        inFlightCalls.remove(job.getId());
        String credentialId = completion.lease().getCredentialId();
        Instant now = clock.instant();

        if (completion.error() == null) {
            pool.recordAttempt(credentialId, AttemptOutcome.SUCCEEDED, null, now);
            job.succeed(completion.value());
            aggregator.onJobSettled(job);
            return;
        }

        ErrorCategory category = ErrorClassifier.classify(completion.error());
        String message = ErrorClassifier.describe(completion.error());
        pool.recordAttempt(credentialId, AttemptOutcome.of(category), message, now);
        log.warn("任务 {} ({}) 在 {} 上失败 [{}/{}]: {}", job.getId(), job.getFileReference(),
                completion.lease().getDisplayName(), category,
                MetagenException.errorCodeOf(completion.error()), message);

        switch (category) {
            case PERMANENT -> {
                job.fail(message);
                aggregator.onJobSettled(job);
            }
            case AUTHENTICATION -> {
                // 凭证已失效，任务换一个凭证，不计入重试
                job.requeue();
                queue.enqueue(job);
            }
            case TRANSIENT, QUOTA -> retryOrFail(job, message);
        }
    }

    /** maxRetries 是瞬时/配额类失败的尝试上限，认证失败不计入 */
    private void retryOrFail(GenerationJob<P, R> job, String message) {
        if (job.countRetryableFailure() < options.getMaxRetries()) {
            job.requeue();
            queue.enqueue(job);
            return;
        }
        job.fail(FailureReasons.RETRIES_EXHAUSTED_PREFIX + message);
        aggregator.onJobSettled(job);
    }

    private void failPending(String reason) {
        for (GenerationJob<P, R> job : queue.drain()) {
            job.fail(reason);
            aggregator.onJobSettled(job);
        }
    }

    /**
     * 调度线程异常时收尾：归还所有在途凭证，结算所有未结束的任务，结束进度流。
     */
    private void abort(RuntimeException cause) {
        String reason = FailureReasons.RUN_ABORTED_PREFIX + ErrorClassifier.describe(cause);
        for (InFlightCall<P, R> entry : inFlightCalls.values()) {
            String credentialId = entry.lease().getCredentialId();
            if (entry.call() == null) {
                pool.recordAttempt(credentialId, AttemptOutcome.TRANSIENT_FAILURE, reason, clock.instant());
            } else {
                // 调用结束前凭证仍被占用
                entry.call().whenComplete((value, error) ->
                        pool.recordAttempt(credentialId, AttemptOutcome.TRANSIENT_FAILURE, reason, clock.instant()));
            }
            settleAsFailed(entry.job(), reason);
        }
        inFlightCalls.clear();
        for (GenerationJob<P, R> job : queue.drain()) {
            settleAsFailed(job, reason);
        }
        changeStatus(RunStatus.CANCELLED);
        aggregator.report(RunStatus.CANCELLED, pool.snapshot(clock.instant()), clock.instant(), clock.instant());
        log.warn("运行 {} 已中止: {}", runId, reason);
    }

    private void settleAsFailed(GenerationJob<P, R> job, String reason) {
        if (job.isTerminal()) {
            return;
        }
        job.fail(reason);
        aggregator.onJobSettled(job);
    }

    private void changeStatus(RunStatus next) {
        status = next;
        aggregator.onRunStatus(next);
    }

    private record Completion<P, R>(GenerationJob<P, R> job, CredentialLease lease, R value, Throwable error) {
    }

    /** call 为空表示生成器尚未返回 */
    private record InFlightCall<P, R>(GenerationJob<P, R> job, CredentialLease lease, CompletableFuture<R> call) {
    }
}
