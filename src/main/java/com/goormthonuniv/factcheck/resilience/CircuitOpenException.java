package com.goormthonuniv.factcheck.resilience;

import java.time.Duration;

/**
 * 브레이커가 호출 자체를 거부했을 때. 네트워크 호출은 일어나지 않는다.
 */
public class CircuitOpenException extends RuntimeException {

    private final String operationClass;
    private final Duration retryAfter;

    public CircuitOpenException(String operationClass, Duration retryAfter) {
        super("Circuit breaker '" + operationClass + "' is open; call rejected");
        this.operationClass = operationClass;
        this.retryAfter = retryAfter;
    }

    public String getOperationClass() { return operationClass; }

    public Duration getRetryAfter() { return retryAfter; }
}
