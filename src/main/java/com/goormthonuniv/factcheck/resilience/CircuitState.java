package com.goormthonuniv.factcheck.resilience;

/**
 * 서킷 브레이커 상태.
 * <pre>
 * CLOSED --(연속 실패 임계치 도달)--> OPEN --(reset timeout 경과)--> HALF_OPEN
 * HALF_OPEN --(시험 호출 성공)--> CLOSED
 * HALF_OPEN --(시험 호출 실패)--> OPEN
 * </pre>
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
