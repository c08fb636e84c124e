package com.goormthonuniv.factcheck.config;

import com.goormthonuniv.factcheck.resilience.BackoffStrategy;
import com.goormthonuniv.factcheck.resilience.CircuitBreakerSettings;
import com.goormthonuniv.factcheck.resilience.ModelCandidate;
import com.goormthonuniv.factcheck.resilience.OperationClass;
import com.goormthonuniv.factcheck.resilience.RetrySettings;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * application.yml 의 {@code factcheck.*} 바인딩.
 */
@Data
@ConfigurationProperties(prefix = "factcheck")
public class FactCheckProperties {

    /** 우선순위 순 후보 모델 */
    private List<ModelProperties> models = new ArrayList<>(List.of(
            new ModelProperties("openrouter:google/gemini-2.5-flash:online", 2000, 60_000),
            new ModelProperties("openrouter:qwen/qwen3-vl-30b-a3b-instruct:online", 2000, 60_000)
    ));
    private RetryProperties retries = new RetryProperties();
    private LoggingProperties logging = new LoggingProperties();
    private double temperature = 0.3;
    private int claimMaxLength = 5000;
    /** 목록에 없는 모델을 지정했을 때 쓰는 값 */
    private int defaultMaxTokens = 2000;
    private long defaultTimeoutMs = 60_000;
    private CacheProperties cache = new CacheProperties();
    private HttpProperties http = new HttpProperties();
    private BackgroundProperties background = new BackgroundProperties();
    private OpenRouterProperties openrouter = new OpenRouterProperties();
    /** key = operation class ("chat", "quick-run", "fact-check" ...) */
    private Map<String, BreakerProperties> circuitBreakers = new HashMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelProperties {
        private String modelId;
        private int maxTokens = 2000;
        private long timeoutMs = 60_000;
    }

    @Data
    public static class RetryProperties {
        private int perModel = 2;
        private int network = 1;
        private long networkDelayMs = 2000;
        private long backoffMs = 1000;
        private BackoffStrategy backoffStrategy = BackoffStrategy.LINEAR;
    }

    @Data
    public static class LoggingProperties {
        private int maxPromptLogLength = 500;
        private int maxResponseLogLength = 1000;
    }

    /** :online 모델은 웹 검색 결과가 매번 달라지므로 기본은 꺼둔다 */
    @Data
    public static class CacheProperties {
        private boolean enabled = false;
        private Duration ttl = Duration.ofHours(24);
        private long maximumSize = 2000;
    }

    @Data
    public static class HttpProperties {
        /** 500 응답에 stack trace 포함(dev 프로파일 전용) */
        private boolean includeErrorDetails = false;
    }

    @Data
    public static class BackgroundProperties {
        private String authToken = "";
    }

    @Data
    public static class OpenRouterProperties {
        private String endpoint = "https://openrouter.ai/api/v1/chat/completions";
        private String apiKey = "";
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class BreakerProperties {
        private Integer failureThreshold;
        private Long resetTimeoutMs;
    }

    public List<ModelCandidate> candidates() {
        return models.stream()
                .map(m -> new ModelCandidate(m.getModelId(), m.getMaxTokens(), m.getTimeoutMs()))
                .toList();
    }

    public RetrySettings retrySettings() {
        return new RetrySettings(
                retries.getPerModel(),
                retries.getNetwork(),
                Duration.ofMillis(retries.getBackoffMs()),
                retries.getBackoffStrategy(),
                logging.getMaxPromptLogLength(),
                logging.getMaxResponseLogLength()
        );
    }

    /** 설정에 적힌 항목만 기본값 위에 덮어쓴다 */
    public Map<OperationClass, CircuitBreakerSettings> breakerOverrides() {
        Map<OperationClass, CircuitBreakerSettings> out = new EnumMap<>(OperationClass.class);
        circuitBreakers.forEach((key, p) -> {
            OperationClass op = OperationClass.fromKey(key)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown operation class in factcheck.circuit-breakers: " + key));
            CircuitBreakerSettings d = op.defaults();
            out.put(op, new CircuitBreakerSettings(
                    p.getFailureThreshold() != null ? p.getFailureThreshold() : d.failureThreshold(),
                    p.getResetTimeoutMs() != null ? Duration.ofMillis(p.getResetTimeoutMs()) : d.resetTimeout()
            ));
        });
        return out;
    }
}
