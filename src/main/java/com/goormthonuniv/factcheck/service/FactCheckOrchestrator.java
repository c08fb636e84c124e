package com.goormthonuniv.factcheck.service;

import com.goormthonuniv.factcheck.config.FactCheckProperties;
import com.goormthonuniv.factcheck.dto.FactCheckRequest;
import com.goormthonuniv.factcheck.dto.FactCheckResponse;
import com.goormthonuniv.factcheck.exception.FactCheckValidationException;
import com.goormthonuniv.factcheck.protocol.FactCheckPrompt;
import com.goormthonuniv.factcheck.protocol.StructuredResult;
import com.goormthonuniv.factcheck.resilience.CircuitBreakerRegistry;
import com.goormthonuniv.factcheck.resilience.CircuitOpenException;
import com.goormthonuniv.factcheck.resilience.ExhaustedCascadeException;
import com.goormthonuniv.factcheck.resilience.InvocationRequest;
import com.goormthonuniv.factcheck.resilience.ModelCandidate;
import com.goormthonuniv.factcheck.resilience.OperationClass;
import com.goormthonuniv.factcheck.resilience.ResilientInvoker;
import com.goormthonuniv.factcheck.tracking.ErrorTracker;
import com.goormthonuniv.factcheck.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 팩트체크 진입점.
 * VALIDATING -> CASCADING -> SUCCEEDED | EXHAUSTED
 * 부분 결과는 없다: 검증된 StructuredResult 이거나 종결 에러.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FactCheckOrchestrator {

    private final ResilientInvoker invoker;
    private final CircuitBreakerRegistry circuitBreakers;
    private final FactCheckResultCache resultCache;
    private final ErrorTracker errorTracker;
    private final FactCheckProperties properties;

    /** 메인 엔트리 */
    public FactCheckResponse factCheck(FactCheckRequest req) {
        // 1) 입력 검증(모델 호출 전)
        validate(req);

        log.info("[FactCheck] Processing claim: {}", TextUtils.preview(req.claim(), 100));
        if (req.instruction() != null) {
            log.info("[FactCheck] Using instruction: {}", req.instruction());
        }
        if (req.hasConversation()) {
            log.info("[FactCheck] Using conversation format with {} messages", req.messages().size());
        }

        // 2) 프롬프트 + 후보 모델
        String userPrompt = FactCheckPrompt.user(req);
        List<ModelCandidate> candidates = resolveCandidates(req);

        // 3) 캐시 -> 브레이커(캐스케이드 전체를 감쌈)
        String cacheKey = resultCache.key(userPrompt, candidates);
        Optional<StructuredResult> cached = resultCache.lookup(cacheKey);
        StructuredResult result;
        if (cached.isPresent()) {
            log.info("[FactCheck] Cache hit");
            result = cached.get();
        } else {
            result = runCascade(req, userPrompt, candidates);
            resultCache.store(cacheKey, result);
        }

        // 4) 응답 매핑
        return new FactCheckResponse(
                result.score() / 100.0,
                formatExplanation(result),
                req.rawRequested() ? result : null
        );
    }

    List<ModelCandidate> resolveCandidates(FactCheckRequest req) {
        List<ModelCandidate> configured = properties.candidates();
        if (req.modelId() == null || req.modelId().isBlank()) {
            return configured;
        }
        List<ModelCandidate> pinned = configured.stream()
                .filter(c -> c.modelId().equals(req.modelId()))
                .toList();
        if (!pinned.isEmpty()) {
            return pinned;
        }
        // 목록에 없는 모델도 단독 후보로 시도(폴백 없음)
        int maxTokens = req.maxTokens() != null ? req.maxTokens() : properties.getDefaultMaxTokens();
        return List.of(new ModelCandidate(req.modelId(), maxTokens, properties.getDefaultTimeoutMs()));
    }

    static String formatExplanation(StructuredResult r) {
        return "## Truth Analysis\n" + r.truthAnalysis()
                + "\n\n## Sources Consulted\n" + r.resourceAnalysis()
                + "\n\n**Confidence:** " + r.confidence() + "/100 | **Accuracy Score:** " + r.score() + "/100";
    }

    private void validate(FactCheckRequest req) {
        if (req == null || req.claim() == null || req.claim().isBlank()) {
            throw new FactCheckValidationException("Invalid request: \"claim\" field is required and must be a string");
        }
        int max = properties.getClaimMaxLength();
        if (req.claim().length() > max) {
            throw new FactCheckValidationException("Claim is too long. Maximum length is " + max + " characters.");
        }
    }

    private StructuredResult runCascade(FactCheckRequest req, String userPrompt, List<ModelCandidate> candidates) {
        InvocationRequest invocation = new InvocationRequest(
                FactCheckPrompt.SYSTEM, userPrompt, properties.getTemperature(), diagnostics(req));
        try {
            return circuitBreakers.get(OperationClass.FACT_CHECK)
                    .execute(() -> invoker.call(candidates, invocation))
                    .result();
        } catch (ExhaustedCascadeException | CircuitOpenException e) {
            // 캐스케이드 소진은 invoker 가 이미 원장과 함께 보고함
            throw e;
        } catch (RuntimeException e) {
            Map<String, Object> ctx = new LinkedHashMap<>();
            ctx.put("endpoint", "factcheck");
            ctx.put("claim", TextUtils.truncate(req.claim(), 100));
            errorTracker.capture(e, ctx);
            throw e;
        }
    }

    private static Map<String, Object> diagnostics(FactCheckRequest req) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("endpoint", "factcheck");
        ctx.put("claim", TextUtils.truncate(req.claim(), 200));
        ctx.put("instruction", req.instruction());
        ctx.put("hasMessages", req.messages() != null);
        ctx.put("messageCount", req.messages() == null ? null : req.messages().size());
        return ctx;
    }
}
