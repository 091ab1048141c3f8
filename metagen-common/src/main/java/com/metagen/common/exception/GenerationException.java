package com.metagen.common.exception;

/**
 * 元数据生成调用的已分类异常。
 * <p>
 * 生成服务的适配器应当抛出（或以此异常完成 Future）以下子类之一，
 * 调度器根据 {@link #getCategory()} 决定重试、转移或终止任务。
 */
public abstract class GenerationException extends MetagenException {

    private final ErrorCategory category;

    protected GenerationException(ErrorCategory category, String errorCode, String message) {
        super(errorCode, message);
        this.category = category;
    }

    protected GenerationException(ErrorCategory category, String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
