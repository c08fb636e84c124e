package com.goormthonuniv.factcheck.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * operation class 별 브레이커 보관소. 생성 시점에 전부 만들어 두고 이후 맵은 바뀌지 않는다.
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final Map<OperationClass, CircuitBreaker> breakers;

    public CircuitBreakerRegistry(Map<OperationClass, CircuitBreakerSettings> overrides, Clock clock) {
        Map<OperationClass, CircuitBreaker> m = new EnumMap<>(OperationClass.class);
        for (OperationClass op : OperationClass.values()) {
            CircuitBreakerSettings s = overrides.getOrDefault(op, op.defaults());
            m.put(op, new CircuitBreaker(op.key(), s, clock));
            log.debug("[CircuitBreaker] {} threshold={} resetTimeout={}", op.key(), s.failureThreshold(), s.resetTimeout());
        }
        this.breakers = Collections.unmodifiableMap(m);
    }

    public CircuitBreaker get(OperationClass operationClass) {
        return breakers.get(operationClass);
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return Arrays.stream(OperationClass.values())
                .map(op -> breakers.get(op).getState())
                .toList();
    }
}
