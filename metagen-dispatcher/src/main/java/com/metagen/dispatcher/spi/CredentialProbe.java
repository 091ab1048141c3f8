package com.metagen.dispatcher.spi;

import com.metagen.dispatcher.validation.ValidationResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 对远程生成服务的轻量探测调用，判断凭证是否可用。
 */
public interface CredentialProbe {

    /**
     * 用给定密钥发起一次探测。
     *
     * @param secret  凭证密钥
     * @param timeout 建议的超时时间（调用方另有硬性超时）
     * @return 探测结论；网络异常可以直接以异常完成
     */
    CompletableFuture<ValidationResult> probe(String secret, Duration timeout);
}
