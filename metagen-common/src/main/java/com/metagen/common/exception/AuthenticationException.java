package com.metagen.common.exception;

/**
 * 凭证被服务端直接拒绝（吊销、密钥无效）。
 */
public class AuthenticationException extends GenerationException {

    public AuthenticationException(String message) {
        super(ErrorCategory.AUTHENTICATION, "AUTH_ERROR", message);
    }
}
