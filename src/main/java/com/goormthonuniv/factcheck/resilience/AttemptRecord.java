package com.goormthonuniv.factcheck.resilience;

import com.goormthonuniv.factcheck.protocol.StructuredResult;

import java.time.Instant;

/**
 * 시도 원장 한 줄. 성공이면 parsedResult, 실패면 error 가 채워진다.
 */
public record AttemptRecord(
        int attemptNumber,            // 호출 전체에서 1부터
        String modelId,
        Instant timestamp,
        String prompt,
        String rawResponse,           // 전송 단계에서 실패하면 null
        AttemptError error,
        StructuredResult parsedResult
) {
    public boolean parseSucceeded() {
        return parsedResult != null;
    }

    public String errorMessage() {
        return error == null ? null : error.message();
    }
}
