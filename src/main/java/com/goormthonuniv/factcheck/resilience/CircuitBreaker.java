package com.goormthonuniv.factcheck.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 연속 실패 횟수 기반 서킷 브레이커.
 * - OPEN -> HALF_OPEN 전이는 백그라운드 타이머가 아니라 호출 시점에 판단
 * - HALF_OPEN 에서는 시험 호출 1건만 통과, 나머지 동시 호출은 즉시 거부
 * - 상태는 operation class 당 하나이며 모든 요청이 같은 카운터를 공유한다
 *
 * 상태를 바꾸는 공개 메서드는 {@link #execute}, {@link #reset} 뿐이다.
 */
@Slf4j
public class CircuitBreaker {

    private final String operationClass;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // lock 으로 보호
    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant lastFailureAt;
    private boolean trialInFlight;

    public CircuitBreaker(String operationClass, CircuitBreakerSettings settings, Clock clock) {
        this.operationClass = Objects.requireNonNull(operationClass, "operationClass");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * 허용되면 operation 을 실행하고 결과에 따라 상태를 갱신한다.
     * 예외는 실패로 기록한 뒤 그대로 다시 던진다.
     *
     * @throws CircuitOpenException OPEN 이거나 HALF_OPEN 시험 호출이 이미 진행 중일 때
     */
    public <T> T execute(Supplier<T> operation) {
        acquirePermission();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            onFailure();
            throw e;
        }
        onSuccess();
        return result;
    }

    public CircuitBreakerSnapshot getState() {
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(operationClass, state, consecutiveFailures, lastFailureAt,
                    settings.failureThreshold(), settings.resetTimeout().toMillis());
        } finally {
            lock.unlock();
        }
    }

    /** 수동 리셋: CLOSED, 카운터 0 */
    public void reset() {
        lock.lock();
        try {
            CircuitState previous = state;
            state = CircuitState.CLOSED;
            consecutiveFailures = 0;
            lastFailureAt = null;
            trialInFlight = false;
            log.info("[CircuitBreaker] {} manually reset (was {})", operationClass, previous);
        } finally {
            lock.unlock();
        }
    }

    public String getOperationClass() { return operationClass; }

    private void acquirePermission() {
        lock.lock();
        try {
            if (state == CircuitState.OPEN) {
                Duration elapsed = Duration.between(lastFailureAt, clock.instant());
                if (elapsed.compareTo(settings.resetTimeout()) > 0) {
                    transitionTo(CircuitState.HALF_OPEN);
                } else {
                    throw new CircuitOpenException(operationClass, settings.resetTimeout().minus(elapsed));
                }
            }
            if (state == CircuitState.HALF_OPEN) {
                if (trialInFlight) {
                    throw new CircuitOpenException(operationClass, Duration.ZERO);
                }
                trialInFlight = true;
            }
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess() {
        lock.lock();
        try {
            trialInFlight = false;
            consecutiveFailures = 0;
            if (state != CircuitState.CLOSED) {
                transitionTo(CircuitState.CLOSED);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onFailure() {
        lock.lock();
        try {
            trialInFlight = false;
            consecutiveFailures++;
            lastFailureAt = clock.instant();
            if (state == CircuitState.HALF_OPEN) {
                transitionTo(CircuitState.OPEN);
            } else if (state == CircuitState.CLOSED && consecutiveFailures >= settings.failureThreshold()) {
                transitionTo(CircuitState.OPEN);
            }
        } finally {
            lock.unlock();
        }
    }

    private void transitionTo(CircuitState next) {
        if (next == CircuitState.OPEN) {
            log.warn("[CircuitBreaker] {} {} -> OPEN after {} consecutive failure(s)",
                    operationClass, state, consecutiveFailures);
        } else {
            log.info("[CircuitBreaker] {} {} -> {}", operationClass, state, next);
        }
        state = next;
    }
}
