package com.goormthonuniv.factcheck.exception;

/** 잘못된 입력. 모델 호출 전에 걸러지며 재시도하지 않는다(HTTP 400). */
public class FactCheckValidationException extends RuntimeException {
    public FactCheckValidationException(String message) {
        super(message);
    }
}
