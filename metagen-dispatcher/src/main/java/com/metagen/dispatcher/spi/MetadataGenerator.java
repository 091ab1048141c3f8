package com.metagen.dispatcher.spi;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 远程元数据生成调用：把一个文件变成元数据。载荷与结果对调度器不透明。
 * <p>
 * 失败时应以 {@link com.metagen.common.exception.GenerationException} 的子类完成 Future，
 * 以便调度器区分重试、换凭证和直接失败；未分类的异常按可重试处理。
 * 实现不应阻塞调用线程。
 *
 * @param <P> 任务载荷类型
 * @param <R> 生成结果类型
 */
@FunctionalInterface
public interface MetadataGenerator<P, R> {

    CompletableFuture<R> generate(String credentialSecret, P payload, Duration timeout);
}
