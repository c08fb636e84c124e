package com.goormthonuniv.factcheck.llm;

import java.time.Duration;

public record LlmCall(
        String modelId,           // provider prefix 포함 가능 (예: "openrouter:google/gemini-2.5-flash:online")
        String systemPrompt,
        String prompt,
        double temperature,
        int maxTokens,
        Duration timeout,         // 호출 1회 제한 시간
        int networkRetries        // 네트워크/API 오류 시 추가 재시도 횟수
) {}
