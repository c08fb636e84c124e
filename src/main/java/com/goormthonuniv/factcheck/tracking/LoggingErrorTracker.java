package com.goormthonuniv.factcheck.tracking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 기본 구현: 진단 payload 를 JSON 한 줄로 ERROR 로그에 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingErrorTracker implements ErrorTracker {

    private final ObjectMapper om;

    @Override
    public void capture(Throwable error, Map<String, Object> context) {
        String payload;
        try {
            payload = om.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            payload = String.valueOf(context);
        }
        log.error("[ErrorTracker] {}: {} context={}", error.getClass().getSimpleName(), error.getMessage(), payload, error);
    }
}
