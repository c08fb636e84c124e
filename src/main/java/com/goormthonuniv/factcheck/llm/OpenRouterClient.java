package com.goormthonuniv.factcheck.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.factcheck.config.FactCheckProperties;
import com.goormthonuniv.factcheck.resilience.Sleeper;
import com.goormthonuniv.factcheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenRouter chat completions 단일 모델 호출.
 * - 요청마다 HttpRequest.timeout 으로 제한 시간 적용
 * - 실패 시 networkRetries 만큼 고정 간격으로 재시도
 */
@Slf4j
@Component
public class OpenRouterClient implements LlmClient {

    static final String PROVIDER_PREFIX = "openrouter:";
    private static final int ERROR_BODY_SAMPLE = 500;

    private final HttpClient http;
    private final ObjectMapper om;
    private final FactCheckProperties.OpenRouterProperties settings;
    private final Duration networkRetryDelay;
    private final Sleeper sleeper;

    public OpenRouterClient(HttpClient http, ObjectMapper om, FactCheckProperties properties, Sleeper sleeper) {
        this.http = http;
        this.om = om;
        this.settings = properties.getOpenrouter();
        this.networkRetryDelay = Duration.ofMillis(properties.getRetries().getNetworkDelayMs());
        this.sleeper = sleeper;
    }

    @Override
    public String complete(LlmCall call) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new LlmTransportException("OpenRouter API key not found. Set OPENROUTER_API_KEY.");
        }
        String body = requestBody(call);

        int maxTries = 1 + Math.max(0, call.networkRetries());
        LlmTransportException last = null;
        for (int t = 1; t <= maxTries; t++) {
            try {
                return send(call, body);
            } catch (LlmTransportException e) {
                last = e;
                log.warn("[OpenRouter] try {}/{} failed for {}: {}", t, maxTries, call.modelId(), e.getMessage());
                if (t < maxTries && !pause()) {
                    break;
                }
            }
        }
        throw last;
    }

    static String modelName(String modelId) {
        return modelId.startsWith(PROVIDER_PREFIX) ? modelId.substring(PROVIDER_PREFIX.length()) : modelId;
    }

    private String requestBody(LlmCall call) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelName(call.modelId()));
        body.put("messages", List.of(
                Map.of("role", "system", "content", call.systemPrompt()),
                Map.of("role", "user", "content", call.prompt())
        ));
        body.put("temperature", call.temperature());
        body.put("max_tokens", call.maxTokens());
        body.put("stream", false);
        try {
            return om.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize OpenRouter request", e);
        }
    }

    private String send(LlmCall call, String body) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(settings.getEndpoint()))
                .timeout(call.timeout())
                .header("Authorization", "Bearer " + settings.getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> res;
        try {
            res = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LlmTransportException("Timed out after " + call.timeout().toMillis() + "ms calling " + call.modelId(), e);
        } catch (IOException e) {
            throw new LlmTransportException("Network error calling OpenRouter: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmTransportException("Interrupted while calling " + call.modelId(), e);
        }

        if (res.statusCode() / 100 != 2) {
            throw new LlmTransportException("OpenRouter API error: " + res.statusCode()
                    + ". Details: " + TextUtils.truncate(res.body(), ERROR_BODY_SAMPLE));
        }

        JsonNode root;
        try {
            root = om.readTree(res.body());
        } catch (JsonProcessingException e) {
            throw new LlmTransportException("Malformed OpenRouter response: " + e.getOriginalMessage(), e);
        }
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            JsonNode error = root.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                throw new LlmTransportException("OpenRouter error: " + error.path("message").asText(error.toString()));
            }
            throw new LlmTransportException("Model returned an empty or whitespace-only response.");
        }
        return content;
    }

    private boolean pause() {
        try {
            sleeper.sleep(networkRetryDelay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
