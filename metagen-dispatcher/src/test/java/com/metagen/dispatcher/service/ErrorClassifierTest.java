package com.metagen.dispatcher.service;

import com.metagen.common.exception.AuthenticationException;
import com.metagen.common.exception.ErrorCategory;
import com.metagen.common.exception.PermanentJobException;
import com.metagen.common.exception.QuotaExceededException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    @Test
    void usesCategoryOfWrappedGenerationException() {
        assertThat(ErrorClassifier.classify(new CompletionException(new QuotaExceededException("429"))))
                .isEqualTo(ErrorCategory.QUOTA);
        assertThat(ErrorClassifier.classify(new AuthenticationException("401")))
                .isEqualTo(ErrorCategory.AUTHENTICATION);
        assertThat(ErrorClassifier.classify(new PermanentJobException("unsupported")))
                .isEqualTo(ErrorCategory.PERMANENT);
    }

    @Test
    void unknownErrorsAreTransient() {
        assertThat(ErrorClassifier.classify(new IOException("reset"))).isEqualTo(ErrorCategory.TRANSIENT);
        assertThat(ErrorClassifier.classify(new CompletionException(new TimeoutException())))
                .isEqualTo(ErrorCategory.TRANSIENT);
    }

    @Test
    void describesTimeoutsAndMessagelessErrors() {
        assertThat(ErrorClassifier.describe(new CompletionException(new TimeoutException()))).isEqualTo("生成调用超时");
        assertThat(ErrorClassifier.describe(new IllegalStateException())).isEqualTo("IllegalStateException");
        assertThat(ErrorClassifier.describe(new IOException("reset"))).isEqualTo("reset");
    }
}
