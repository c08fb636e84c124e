package com.goormthonuniv.factcheck.controller;

import com.goormthonuniv.factcheck.auth.BackgroundAuthGuard;
import com.goormthonuniv.factcheck.dto.FactCheckRequest;
import com.goormthonuniv.factcheck.dto.FactCheckResponse;
import com.goormthonuniv.factcheck.service.FactCheckOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class FactCheckController {

    private final FactCheckOrchestrator orchestrator;
    private final BackgroundAuthGuard authGuard;

    @Operation(summary = "주장 사실 검증", description = "claim(또는 대화 전체)을 전달하면 0~1 점수와 분석 설명을 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "검증 성공"),
            @ApiResponse(responseCode = "400", description = "claim 누락/초과 등 요청 형식 오류"),
            @ApiResponse(responseCode = "405", description = "POST 외 메서드"),
            @ApiResponse(responseCode = "500", description = "모든 모델/재시도 실패"),
            @ApiResponse(responseCode = "503", description = "서킷 브레이커 OPEN")
    })
    @PostMapping("/factcheck")
    public ResponseEntity<FactCheckResponse> factCheck(@Valid @RequestBody FactCheckRequest req) {
        return ResponseEntity.ok(orchestrator.factCheck(req));
    }

    @Operation(summary = "주장 사실 검증(백그라운드 호출)", description = "공유 비밀 토큰 헤더가 필요한 내부 호출용 엔드포인트")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "검증 성공"),
            @ApiResponse(responseCode = "401", description = "토큰 누락/불일치")
    })
    @PostMapping("/factcheck/background")
    public ResponseEntity<FactCheckResponse> factCheckBackground(
            @RequestHeader(value = BackgroundAuthGuard.HEADER, required = false) String token,
            @RequestBody FactCheckRequest req) {
        // 인증을 먼저, 입력 검증은 orchestrator 에서
        authGuard.check(token);
        return ResponseEntity.ok(orchestrator.factCheck(req));
    }
}
