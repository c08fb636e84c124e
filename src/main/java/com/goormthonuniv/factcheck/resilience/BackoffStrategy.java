package com.goormthonuniv.factcheck.resilience;

import java.time.Duration;

/**
 * 같은 모델 재시도 사이의 대기 시간.
 * attemptIndex 는 방금 실패한 시도의 1부터 시작하는 번호.
 */
public enum BackoffStrategy {
    /** base * attemptIndex (1s, 2s, 3s ...) */
    LINEAR {
        @Override
        public Duration delay(Duration base, int attemptIndex) {
            return base.multipliedBy(attemptIndex);
        }
    },
    /** base * 2^(attemptIndex-1) (1s, 2s, 4s ...) */
    EXPONENTIAL {
        @Override
        public Duration delay(Duration base, int attemptIndex) {
            return base.multipliedBy(1L << Math.min(attemptIndex - 1, 20));
        }
    };

    public abstract Duration delay(Duration base, int attemptIndex);
}
