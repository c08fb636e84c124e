package com.goormthonuniv.factcheck.resilience;

/**
 * 시도 1회의 실패. 캐스케이드 루프 안에서는 예외가 아닌 값으로 전달된다.
 */
public record AttemptError(Kind kind, String message) {

    public enum Kind {
        /** 타임아웃/네트워크/API 오류 */
        TRANSPORT,
        /** 필수 태그 누락 */
        PROTOCOL_PARSE,
        /** CONFIDENCE/SCORE 가 정수가 아니거나 0~100 밖 */
        RANGE_VALIDATION
    }
}
