package com.metagen.ai.provider;

import com.metagen.common.exception.AuthenticationException;
import com.metagen.common.exception.GenerationException;
import com.metagen.common.exception.PermanentJobException;
import com.metagen.common.exception.QuotaExceededException;
import com.metagen.common.exception.TransientNetworkException;

import java.util.Locale;

/**
 * 把 HTTP 错误响应映射为调度模块能识别的异常类别。
 */
final class HttpErrorClassifier {

    private HttpErrorClassifier() {
    }

    static GenerationException classify(int code, String body, String detail) {
        String lower = body == null ? "" : body.toLowerCase(Locale.ROOT);
        String message = "HTTP " + code + (detail == null || detail.isBlank() ? "" : ": " + detail);

        if (code == 401 || code == 403 || (code == 400 && mentionsInvalidKey(lower))) {
            return new AuthenticationException(message);
        }
        if (code == 429 || lower.contains("quota") || lower.contains("rate limit")) {
            return new QuotaExceededException(message);
        }
        if (code == 408 || code >= 500) {
            return new TransientNetworkException(message);
        }
        return new PermanentJobException(message);
    }

    private static boolean mentionsInvalidKey(String lowerBody) {
        return lowerBody.contains("api key") || lowerBody.contains("api_key") || lowerBody.contains("invalid key");
    }
}
