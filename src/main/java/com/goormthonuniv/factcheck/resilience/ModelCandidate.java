package com.goormthonuniv.factcheck.resilience;

import java.time.Duration;
import java.util.Objects;

/** 폴백 후보 모델. 리스트 순서가 곧 우선순위 */
public record ModelCandidate(
        String modelId,
        int maxTokens,
        long timeoutMs
) {
    public ModelCandidate {
        Objects.requireNonNull(modelId, "modelId");
        if (modelId.isBlank()) throw new IllegalArgumentException("modelId must not be blank");
        if (maxTokens < 1) throw new IllegalArgumentException("maxTokens must be >= 1: " + maxTokens);
        if (timeoutMs < 1) throw new IllegalArgumentException("timeoutMs must be >= 1: " + timeoutMs);
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }
}
