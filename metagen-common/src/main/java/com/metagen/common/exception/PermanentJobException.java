package com.metagen.common.exception;

/**
 * 输入文件本身被服务端拒绝（如内容不支持），任务终止且不重试。
 */
public class PermanentJobException extends GenerationException {

    public PermanentJobException(String message) {
        super(ErrorCategory.PERMANENT, "JOB_REJECTED", message);
    }
}
