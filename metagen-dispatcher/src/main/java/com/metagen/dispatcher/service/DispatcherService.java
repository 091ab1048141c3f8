package com.metagen.dispatcher.service;

import com.metagen.common.dto.CredentialState;
import com.metagen.common.dto.CredentialStats;
import com.metagen.common.exception.CredentialNotFoundException;
import com.metagen.common.exception.CredentialValidationException;
import com.metagen.common.util.IdGenerator;
import com.metagen.dispatcher.config.DispatcherProperties;
import com.metagen.dispatcher.job.GenerationJob;
import com.metagen.dispatcher.job.JobRequest;
import com.metagen.dispatcher.pool.CredentialPool;
import com.metagen.dispatcher.spi.MetadataGenerator;
import com.metagen.dispatcher.validation.CredentialActivator;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 多凭证限流调度服务：把一批文件任务分发到凭证池中的各个凭证上。
 * <p>
 * 核心策略：
 * - 每个凭证同一时刻最多一个在途任务，并受滑动窗口限流
 * - 最久未使用的凭证优先，均匀分摊负载
 * - 瞬时错误重试、认证错误换凭证、输入错误直接失败，单个任务或凭证的失败不会中断整批运行
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatcherService {

    private final CredentialPool credentialPool;
    private final CredentialActivator credentialActivator;
    private final DispatcherProperties properties;
    private final Clock clock;

    private final AtomicInteger runCounter = new AtomicInteger();

    /** 每次运行占用一个调度线程，生成调用本身是异步的 */
    private final ExecutorService coordinatorPool = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "dispatch-run-" + runCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    /**
     * 使用配置的默认策略启动一次运行。
     */
    public <P, R> RunHandle<R> run(List<JobRequest<P>> requests, MetadataGenerator<P, R> generator) {
        return run(requests, generator, RunOptions.from(properties));
    }

    /**
     * 启动一次批量运行，立即返回句柄。尚未校验的凭证会在运行开始时自动校验。
     *
     * @param requests  待处理的文件，每个文件一个任务
     * @param generator 实际的生成调用
     * @param options   重试次数、单凭证容量等策略；同时进行的运行按其中最小的容量限流
     * @throws IllegalArgumentException 策略参数超出范围
     */
    public <P, R> RunHandle<R> run(List<JobRequest<P>> requests, MetadataGenerator<P, R> generator,
                                   RunOptions options) {
        options.validate();
        String runId = IdGenerator.runId();
        List<GenerationJob<P, R>> jobs = requests.stream()
                .map(request -> new GenerationJob<P, R>(IdGenerator.jobId(),
                        request.getFileReference(), request.getPayload()))
                .toList();

        DispatchRun<P, R> run = new DispatchRun<>(runId, jobs, credentialPool, credentialActivator,
                generator, options, clock, properties.getSchedulingTickMillis());
        coordinatorPool.execute(run);
        return new RunHandle<>(run);
    }

    /**
     * 添加凭证并立即校验。
     *
     * @return 校验通过时以凭证快照完成；校验失败时以 {@link CredentialValidationException} 完成，
     * 凭证以 INVALID 状态留在池中
     */
    public CompletableFuture<CredentialStats> addCredential(String secret, String displayName) {
        CredentialStats added = credentialPool.add(secret, displayName);
        return credentialActivator.activate(added.getId())
                .thenApply(stats -> {
                    if (stats.getState() == CredentialState.INVALID) {
                        throw new CredentialValidationException(stats.getId(), stats.getLastError());
                    }
                    return stats;
                });
    }

    /**
     * 移除凭证；凭证正被使用时，待当前任务结束后移除。
     */
    public void removeCredential(String credentialId) {
        if (!IdGenerator.isCredentialId(credentialId) || !credentialPool.remove(credentialId)) {
            throw new CredentialNotFoundException(credentialId);
        }
    }

    /**
     * 各凭证的用量快照。
     */
    public List<CredentialStats> getStats() {
        return credentialPool.snapshot(clock.instant());
    }

    @PreDestroy
    public void shutdown() {
        coordinatorPool.shutdownNow();
    }
}
