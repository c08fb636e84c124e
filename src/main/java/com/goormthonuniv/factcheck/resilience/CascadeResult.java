package com.goormthonuniv.factcheck.resilience;

import com.goormthonuniv.factcheck.protocol.StructuredResult;

import java.util.List;

public record CascadeResult(
        StructuredResult result,
        String modelId,               // 성공한 모델
        List<AttemptRecord> attempts  // 마지막 항목이 성공한 시도
) {}
