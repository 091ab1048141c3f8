package com.metagen.common.exception;

/**
 * 调度器异常的父类，带一个稳定的错误码（如 AUTH_ERROR、QUOTA_EXCEEDED），
 * 日志和失败报告按错误码归类。
 */
public class MetagenException extends RuntimeException {

    /** 异常链中没有 MetagenException 时使用的错误码 */
    public static final String UNCLASSIFIED = "UNCLASSIFIED";

    private final String errorCode;

    public MetagenException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MetagenException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * 沿异常链查找第一个 MetagenException 的错误码。
     */
    public static String errorCodeOf(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof MetagenException metagenException) {
                return metagenException.getErrorCode();
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return UNCLASSIFIED;
    }

    @Override
    public String toString() {
        return "[" + errorCode + "] " + getMessage();
    }
}
