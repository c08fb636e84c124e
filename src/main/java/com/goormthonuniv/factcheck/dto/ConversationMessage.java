package com.goormthonuniv.factcheck.dto;

import jakarta.validation.constraints.NotNull;

public record ConversationMessage(
        @NotNull String role,     // "user" | "assistant" | "system"
        String content,
        Boolean generated         // assistant 전용: true 면 검증 대상(모델 생성 응답)
) {
    public boolean isGenerated() {
        return Boolean.TRUE.equals(generated);
    }
}
