package com.goormthonuniv.factcheck.resilience;

import java.time.Instant;

public record CircuitBreakerSnapshot(
        String operationClass,
        CircuitState state,
        int consecutiveFailures,
        Instant lastFailureAt,    // 실패 이력이 없으면 null
        int failureThreshold,
        long resetTimeoutMs
) {}
