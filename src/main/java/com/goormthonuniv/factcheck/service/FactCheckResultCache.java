package com.goormthonuniv.factcheck.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.factcheck.config.FactCheckProperties;
import com.goormthonuniv.factcheck.protocol.StructuredResult;
import com.goormthonuniv.factcheck.resilience.ModelCandidate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * 같은 프롬프트 + 같은 후보 모델(토큰/타임아웃 포함)이면 검증된 결과를 재사용.
 * factcheck.cache.enabled=true 일 때만 동작하고, 검증을 통과한 결과만 저장한다.
 */
@Component
public class FactCheckResultCache {

    private final boolean enabled;
    private final Cache<String, StructuredResult> cache;

    @Autowired
    public FactCheckResultCache(FactCheckProperties properties) {
        this(properties.getCache().isEnabled(), properties.getCache().getTtl(), properties.getCache().getMaximumSize());
    }

    public FactCheckResultCache(boolean enabled, Duration ttl, long maximumSize) {
        this.enabled = enabled;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
    }

    public static FactCheckResultCache disabled() {
        return new FactCheckResultCache(false, Duration.ofMinutes(1), 1);
    }

    public String key(String userPrompt, List<ModelCandidate> candidates) {
        StringBuilder sb = new StringBuilder(userPrompt);
        for (ModelCandidate c : candidates) {
            sb.append('\u0000').append(c.modelId())
                    .append('\u0000').append(c.maxTokens())
                    .append('\u0000').append(c.timeoutMs());
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Optional<StructuredResult> lookup(String key) {
        if (!enabled) return Optional.empty();
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void store(String key, StructuredResult result) {
        if (enabled) cache.put(key, result);
    }
}
