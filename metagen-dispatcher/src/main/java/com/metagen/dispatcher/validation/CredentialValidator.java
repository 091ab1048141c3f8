package com.metagen.dispatcher.validation;

import com.metagen.dispatcher.spi.CredentialProbe;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 凭证校验器：每次校验只发起一次探测，带硬性超时，不做内部重试。
 * <p>
 * 只返回结论，不直接修改凭证池，由调用方决定如何应用。
 */
@Slf4j
public class CredentialValidator {

    private final CredentialProbe probe;
    private final Duration timeout;

    public CredentialValidator(CredentialProbe probe, Duration timeout) {
        this.probe = probe;
        this.timeout = timeout;
    }

    /**
     * 校验密钥。返回的 Future 总是正常完成，失败原因体现在结果中。
     */
    public CompletableFuture<ValidationResult> validate(String secret) {
        if (secret == null || secret.isBlank()) {
            return CompletableFuture.completedFuture(ValidationResult.invalid("密钥为空"));
        }

        CompletableFuture<ValidationResult> call;
        try {
            call = probe.probe(secret, timeout);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            call = CompletableFuture.failedFuture(new IllegalStateException("探测返回了空 Future"));
        }

        return call
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, ex) -> {
                    if (ex == null) {
                        return result != null ? result : ValidationResult.invalid("探测未返回结果");
                    }
                    Throwable cause = unwrap(ex);
                    if (cause instanceof TimeoutException) {
                        log.warn("凭证探测超时 ({}s)", timeout.toSeconds());
                        return ValidationResult.invalid("校验超时（" + timeout.toSeconds() + " 秒）");
                    }
                    log.warn("凭证探测失败: {}", cause.getMessage());
                    return ValidationResult.invalid(cause.getMessage() != null
                            ? cause.getMessage()
                            : cause.getClass().getSimpleName());
                });
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
