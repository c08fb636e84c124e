package com.goormthonuniv.factcheck.llm;

/** 타임아웃, 네트워크 오류, 공급자 API 오류, 빈 응답 */
public class LlmTransportException extends RuntimeException {

    public LlmTransportException(String message) {
        super(message);
    }

    public LlmTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
