package com.goormthonuniv.factcheck.resilience;

import java.time.Duration;
import java.util.Objects;

public record CircuitBreakerSettings(
        int failureThreshold,     // 연속 실패 몇 번에 OPEN
        Duration resetTimeout     // OPEN 유지 시간(이후 HALF_OPEN 시험 호출 1회)
) {
    public CircuitBreakerSettings {
        Objects.requireNonNull(resetTimeout, "resetTimeout");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        if (resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must not be negative: " + resetTimeout);
        }
    }

    public static CircuitBreakerSettings of(int failureThreshold, long resetTimeoutMs) {
        return new CircuitBreakerSettings(failureThreshold, Duration.ofMillis(resetTimeoutMs));
    }
}
