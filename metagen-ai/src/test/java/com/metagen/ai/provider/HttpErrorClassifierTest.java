package com.metagen.ai.provider;

import com.metagen.common.exception.ErrorCategory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HttpErrorClassifierTest {

    @Test
    void mapsStatusCodesToCategories() {
        assertThat(HttpErrorClassifier.classify(401, "", null).getCategory()).isEqualTo(ErrorCategory.AUTHENTICATION);
        assertThat(HttpErrorClassifier.classify(403, "", null).getCategory()).isEqualTo(ErrorCategory.AUTHENTICATION);
        assertThat(HttpErrorClassifier.classify(429, "", null).getCategory()).isEqualTo(ErrorCategory.QUOTA);
        assertThat(HttpErrorClassifier.classify(408, "", null).getCategory()).isEqualTo(ErrorCategory.TRANSIENT);
        assertThat(HttpErrorClassifier.classify(502, "", null).getCategory()).isEqualTo(ErrorCategory.TRANSIENT);
        assertThat(HttpErrorClassifier.classify(404, "", null).getCategory()).isEqualTo(ErrorCategory.PERMANENT);
    }

    @Test
    void bodyMentioningQuotaIsQuotaEvenWithOtherStatus() {
        assertThat(HttpErrorClassifier.classify(400, "{\"error\":\"Quota exceeded for model\"}", null).getCategory())
                .isEqualTo(ErrorCategory.QUOTA);
    }

    @Test
    void carriesStableErrorCodes() {
        assertThat(HttpErrorClassifier.classify(401, "", null).getErrorCode()).isEqualTo("AUTH_ERROR");
        assertThat(HttpErrorClassifier.classify(429, "", null).getErrorCode()).isEqualTo("QUOTA_EXCEEDED");
        assertThat(HttpErrorClassifier.classify(503, "", null).getErrorCode()).isEqualTo("NETWORK_ERROR");
        assertThat(HttpErrorClassifier.classify(422, "", null).getErrorCode()).isEqualTo("JOB_REJECTED");
    }

    @Test
    void messageCarriesStatusAndDetail() {
        assertThat(HttpErrorClassifier.classify(404, "", "model not found").getMessage())
                .isEqualTo("HTTP 404: model not found");
        assertThat(HttpErrorClassifier.classify(500, "", "").getMessage()).isEqualTo("HTTP 500");
    }
}
