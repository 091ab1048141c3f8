package com.metagen.common.exception;

/**
 * 服务端返回配额/速率超限。本地滑动窗口认为仍有余量时也可能发生（时钟偏差、外部共用）。
 */
public class QuotaExceededException extends GenerationException {

    public QuotaExceededException(String message) {
        super(ErrorCategory.QUOTA, "QUOTA_EXCEEDED", message);
    }
}
