package com.metagen.dispatcher.service;

import com.metagen.common.exception.ErrorCategory;
import com.metagen.common.exception.GenerationException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 把生成调用的异常归入 {@link ErrorCategory}。
 * 未分类的异常（超时、I/O、运行时错误）一律按 TRANSIENT 处理，由重试上限兜底。
 */
final class ErrorClassifier {

    private ErrorClassifier() {
    }

    static ErrorCategory classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof GenerationException generationException) {
            return generationException.getCategory();
        }
        return ErrorCategory.TRANSIENT;
    }

    static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return "生成调用超时";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
