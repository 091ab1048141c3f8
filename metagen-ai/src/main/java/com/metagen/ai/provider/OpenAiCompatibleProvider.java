package com.metagen.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metagen.ai.config.AiProperties;
import com.metagen.common.exception.PermanentJobException;
import com.metagen.common.exception.TransientNetworkException;
import com.metagen.common.util.MediaUtils;
import com.metagen.dispatcher.spi.CredentialProbe;
import com.metagen.dispatcher.spi.MetadataGenerator;
import com.metagen.dispatcher.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * OpenAI 兼容 Chat Completions 接口的生成器与凭证探测实现。
 * <p>
 * 调用全部走 OkHttp 异步 {@code enqueue}，不占用调度线程；每次调用的总超时由调用方传入。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiCompatibleProvider implements MetadataGenerator<GenerationRequest, String>, CredentialProbe {

    private final OkHttpClient aiHttpClient;
    private final AiProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    // ======================== 生成调用 ========================

    @Override
    public CompletableFuture<String> generate(String credentialSecret, GenerationRequest payload, Duration timeout) {
        String requestBody;
        try {
            requestBody = buildRequestBody(payload);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new PermanentJobException("构建请求体失败: " + e.getMessage()));
        }

        Request request = new Request.Builder()
                .url(properties.getBaseUrl() + "/chat/completions")
                .addHeader("Authorization", "Bearer " + credentialSecret)
                .post(RequestBody.create(requestBody, JSON_MEDIA))
                .build();

        CompletableFuture<String> future = new CompletableFuture<>();
        Call call = aiHttpClient.newCall(request);
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(networkError(e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    String body = response.body() != null ? response.body().string() : "";
                    if (!response.isSuccessful()) {
                        log.warn("生成接口返回错误: {} ({})", response.code(), payload.getFileName());
                        future.completeExceptionally(
                                HttpErrorClassifier.classify(response.code(), body, extractError(body)));
                        return;
                    }
                    future.complete(parseContent(body));
                } catch (PermanentJobException e) {
                    future.completeExceptionally(e);
                } catch (IOException e) {
                    future.completeExceptionally(networkError(e));
                }
            }
        });
        return future;
    }

    // ======================== 凭证探测 ========================

    @Override
    public CompletableFuture<ValidationResult> probe(String secret, Duration timeout) {
        Request request = new Request.Builder()
                .url(properties.getBaseUrl() + properties.getProbePath())
                .addHeader("Authorization", "Bearer " + secret)
                .get()
                .build();

        CompletableFuture<ValidationResult> future = new CompletableFuture<>();
        Call call = aiHttpClient.newCall(request);
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.complete(ValidationResult.invalid("无法连接接口: " + describe(e)));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (response.isSuccessful()) {
                        future.complete(ValidationResult.valid());
                        return;
                    }
                    String body = response.body() != null ? response.body().string() : "";
                    String detail = extractError(body);
                    future.complete(ValidationResult.invalid("HTTP " + response.code()
                            + (detail.isBlank() ? "" : ": " + detail)));
                } catch (IOException e) {
                    future.complete(ValidationResult.invalid("读取响应失败: " + describe(e)));
                }
            }
        });
        return future;
    }

    // ======================== 公共方法 ========================

    /**
     * 构建 Chat Completions 请求体，图片以 data URI 附在文字之后。
     */
    String buildRequestBody(GenerationRequest payload) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.getModel());
        root.put("max_tokens", properties.getMaxTokens());
        root.put("temperature", properties.getTemperature());

        ArrayNode messages = root.putArray("messages");
        ObjectNode userMsg = messages.addObject();
        userMsg.put("role", "user");
        ArrayNode content = userMsg.putArray("content");

        ObjectNode textPart = content.addObject();
        textPart.put("type", "text");
        textPart.put("text", payload.getPrompt());

        if (payload.getImageBase64() != null && !payload.getImageBase64().isEmpty()) {
            String mimeType = payload.getMimeType() != null
                    ? payload.getMimeType()
                    : MediaUtils.getMimeType(payload.getFileName());
            ObjectNode imagePart = content.addObject();
            imagePart.put("type", "image_url");
            imagePart.putObject("image_url").put("url", MediaUtils.toDataUri(payload.getImageBase64(), mimeType));
        }

        return objectMapper.writeValueAsString(root);
    }

    private String parseContent(String body) throws IOException {
        JsonNode json = objectMapper.readTree(body);
        String result = json.path("choices").path(0).path("message").path("content").asText();
        if (result.isEmpty()) {
            throw new PermanentJobException("接口返回空内容");
        }
        return result;
    }

    /**
     * 提取错误响应中的 error.message，非 JSON 时返回原文。
     */
    private String extractError(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode message = objectMapper.readTree(body).path("error").path("message");
            return message.isTextual() ? message.asText() : body;
        } catch (IOException e) {
            return body;
        }
    }

    private static TransientNetworkException networkError(IOException e) {
        return new TransientNetworkException("网络错误: " + describe(e), e);
    }

    private static String describe(IOException e) {
        if (e instanceof InterruptedIOException) {
            return "调用超时";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
