package com.goormthonuniv.factcheck.resilience;

import java.time.Duration;
import java.util.Objects;

public record RetrySettings(
        int retriesPerModel,          // 모델당 시도 횟수(파싱 실패 포함)
        int networkRetries,           // LlmClient 내부 네트워크 재시도 예산
        Duration backoff,             // 재시도 대기 기준값
        BackoffStrategy backoffStrategy,
        int maxPromptLogLength,       // 원장 리포트 시 프롬프트 샘플 길이
        int maxResponseLogLength      // 원장 리포트 시 응답 샘플 길이
) {
    public RetrySettings {
        Objects.requireNonNull(backoff, "backoff");
        Objects.requireNonNull(backoffStrategy, "backoffStrategy");
        if (retriesPerModel < 1) throw new IllegalArgumentException("retriesPerModel must be >= 1");
        if (networkRetries < 0) throw new IllegalArgumentException("networkRetries must be >= 0");
    }

    public Duration backoffAfter(int attemptIndex) {
        return backoffStrategy.delay(backoff, attemptIndex);
    }
}
