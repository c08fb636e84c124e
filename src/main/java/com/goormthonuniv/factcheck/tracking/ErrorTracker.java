package com.goormthonuniv.factcheck.tracking;

import java.util.Map;

/**
 * 외부 에러 트래킹 연동 지점.
 */
public interface ErrorTracker {
    void capture(Throwable error, Map<String, Object> context);
}
