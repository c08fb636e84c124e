package com.goormthonuniv.factcheck.resilience;

import java.util.Map;
import java.util.Objects;

/**
 * @param diagnostics 전부 실패했을 때 에러 트래커로 함께 보낼 호출자 측 맥락
 */
public record InvocationRequest(
        String systemPrompt,
        String userPrompt,
        double temperature,
        Map<String, Object> diagnostics
) {
    public InvocationRequest {
        Objects.requireNonNull(systemPrompt, "systemPrompt");
        Objects.requireNonNull(userPrompt, "userPrompt");
        diagnostics = diagnostics == null ? Map.of() : diagnostics;
    }
}
