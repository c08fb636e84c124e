package com.goormthonuniv.factcheck.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

public record FactCheckRequest(
        @NotBlank @Size(max = 5000) String claim,  // 검증할 주장(대화 형식이어도 필수)
        String instruction,                        // 선택: 검증 시 집중할 포인트
        List<@Valid ConversationMessage> messages, // 선택: 전체 대화 맥락
        String modelId,                            // 선택: 모델 고정(폴백 없음)
        @Positive Integer maxTokens,               // 선택: 목록에 없는 모델일 때만 사용
        Boolean includeRaw                         // 선택: 파싱된 원본 섹션 포함 여부
) {
    public static FactCheckRequest ofClaim(String claim) {
        return new FactCheckRequest(claim, null, null, null, null, null);
    }

    public boolean hasConversation() {
        return messages != null && !messages.isEmpty();
    }

    public boolean rawRequested() {
        return Boolean.TRUE.equals(includeRaw);
    }
}
