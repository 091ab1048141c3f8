package com.metagen.common.exception;

/**
 * 网络连接失败或超时，属于可重试错误。
 */
public class TransientNetworkException extends GenerationException {

    public TransientNetworkException(String message) {
        super(ErrorCategory.TRANSIENT, "NETWORK_ERROR", message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(ErrorCategory.TRANSIENT, "NETWORK_ERROR", message, cause);
    }
}
