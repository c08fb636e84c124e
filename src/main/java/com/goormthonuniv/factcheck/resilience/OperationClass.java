package com.goormthonuniv.factcheck.resilience;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * 브레이커를 따로 두는 작업 단위. 각 클래스는 독립된 카운터를 가진다.
 */
public enum OperationClass {
    CHAT("chat", CircuitBreakerSettings.of(3, 60_000)),
    CREATE("create", CircuitBreakerSettings.of(3, 60_000)),
    UPDATE("update", CircuitBreakerSettings.of(3, 60_000)),
    QUICK_RUN("quick-run", CircuitBreakerSettings.of(2, 30_000)), // 비싼 작업이라 더 빨리 차단
    FACT_CHECK("fact-check", CircuitBreakerSettings.of(3, 60_000));

    private final String key;
    private final CircuitBreakerSettings defaults;

    OperationClass(String key, CircuitBreakerSettings defaults) {
        this.key = key;
        this.defaults = defaults;
    }

    public String key() { return key; }

    public CircuitBreakerSettings defaults() { return defaults; }

    public static Optional<OperationClass> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(o -> o.key.equals(k)).findFirst();
    }
}
