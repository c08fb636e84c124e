package com.goormthonuniv.factcheck.protocol;

import java.util.Objects;

/**
 * 검증까지 통과한 팩트체크 응답. 범위를 벗어난 값으로는 만들 수 없다.
 */
public record StructuredResult(
        String resourceAnalysis,  // 참고 출처 분석
        String truthAnalysis,     // 사실 여부 분석
        int confidence,           // 0~100
        int score                 // 0~100
) {
    public static final int MIN = 0;
    public static final int MAX = 100;

    public StructuredResult {
        Objects.requireNonNull(resourceAnalysis, "resourceAnalysis");
        Objects.requireNonNull(truthAnalysis, "truthAnalysis");
        if (!inRange(confidence)) throw new IllegalArgumentException("confidence out of range: " + confidence);
        if (!inRange(score)) throw new IllegalArgumentException("score out of range: " + score);
    }

    public static boolean inRange(int value) {
        return value >= MIN && value <= MAX;
    }
}
