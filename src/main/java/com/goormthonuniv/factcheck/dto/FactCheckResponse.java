package com.goormthonuniv.factcheck.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.goormthonuniv.factcheck.protocol.StructuredResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FactCheckResponse(
        double score,             // 0.0~1.0 (StructuredResult.score / 100)
        String explain,           // 분석 + 출처 + 신뢰도 요약(markdown)
        StructuredResult raw      // includeRaw=true 일 때만
) {}
