package com.metagen.dispatcher.service;

import com.metagen.dispatcher.config.DispatcherProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 单次运行的策略参数。
 */
@Getter
@Builder
@ToString
public class RunOptions {

    public static final long DEFAULT_GENERATION_TIMEOUT_SECONDS = 60;

    /**
     * 单个任务因瞬时/配额类失败最多尝试的次数：第 n 次这类失败后，n &lt; maxRetries 才重新排队。
     * 认证失败换凭证重派，不计入。
     */
    private final int maxRetries;

    /** 每个凭证每个窗口的请求上限 */
    private final int perCredentialCapacityPerMinute;

    /** 单次生成调用的硬性超时 */
    @Builder.Default
    private final Duration generationTimeout = Duration.ofSeconds(DEFAULT_GENERATION_TIMEOUT_SECONDS);

    public static RunOptions from(DispatcherProperties properties) {
        return RunOptions.builder()
                .maxRetries(properties.getMaxRetries())
                .perCredentialCapacityPerMinute(properties.getPerCredentialCapacityPerMinute())
                .generationTimeout(Duration.ofSeconds(properties.getGenerationTimeoutSeconds()))
                .build();
    }

    /**
     * 启动运行前的参数检查。
     *
     * @throws IllegalArgumentException 参数超出范围
     */
    public void validate() {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries 不能为负数: " + maxRetries);
        }
        if (perCredentialCapacityPerMinute < 1) {
            throw new IllegalArgumentException("perCredentialCapacityPerMinute 至少为 1: " + perCredentialCapacityPerMinute);
        }
        if (generationTimeout == null || generationTimeout.isZero() || generationTimeout.isNegative()) {
            throw new IllegalArgumentException("generationTimeout 必须为正: " + generationTimeout);
        }
    }
}
