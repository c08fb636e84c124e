package com.goormthonuniv.factcheck.auth;

import com.goormthonuniv.factcheck.config.FactCheckProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 백그라운드 호출용 공유 비밀 토큰 검사.
 * 서버에 토큰이 설정되어 있지 않으면 모든 요청을 거부한다.
 */
@Slf4j
@Component
public class BackgroundAuthGuard {

    public static final String HEADER = "X-Background-Function-Auth";

    private final byte[] expected;

    public BackgroundAuthGuard(FactCheckProperties properties) {
        String token = properties.getBackground().getAuthToken();
        this.expected = token == null ? new byte[0] : token.getBytes(StandardCharsets.UTF_8);
    }

    public void check(String presented) {
        if (expected.length == 0) {
            log.warn("[FactCheck] background auth token is not configured; rejecting request");
            throw new BackgroundAuthException("Background function authentication is not configured");
        }
        if (presented == null
                || !MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8))) {
            throw new BackgroundAuthException("Unauthorized: invalid or missing " + HEADER + " header");
        }
    }
}
