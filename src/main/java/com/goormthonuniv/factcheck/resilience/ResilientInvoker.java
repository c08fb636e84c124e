package com.goormthonuniv.factcheck.resilience;

import com.goormthonuniv.factcheck.llm.LlmCall;
import com.goormthonuniv.factcheck.llm.LlmClient;
import com.goormthonuniv.factcheck.protocol.ParseResult;
import com.goormthonuniv.factcheck.protocol.StructuredResponseProtocol;
import com.goormthonuniv.factcheck.protocol.StructuredResult;
import com.goormthonuniv.factcheck.tracking.ErrorTracker;
import com.goormthonuniv.factcheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 후보 모델을 순서대로, 모델마다 retriesPerModel 번까지 시도하는 캐스케이드.
 * <ul>
 *   <li>파싱/범위 검증 실패도 전송 실패와 똑같이 재시도 대상</li>
 *   <li>같은 모델 재시도 사이에만 backoff 대기, 다음 모델로 넘어갈 때는 바로</li>
 *   <li>첫 성공에서 즉시 반환</li>
 *   <li>모델 호출은 한 번에 하나만(병렬 없음). 원장 순서가 곧 시도 순서</li>
 * </ul>
 * 전부 실패하면 원장 전체를 에러 트래커로 보내고 {@link ExhaustedCascadeException} 을 던진다.
 */
@Slf4j
public class ResilientInvoker {

    private final LlmClient llmClient;
    private final StructuredResponseProtocol protocol;
    private final ErrorTracker errorTracker;
    private final RetrySettings retry;
    private final Sleeper sleeper;
    private final Clock clock;

    public ResilientInvoker(LlmClient llmClient,
                            StructuredResponseProtocol protocol,
                            ErrorTracker errorTracker,
                            RetrySettings retry,
                            Sleeper sleeper,
                            Clock clock) {
        this.llmClient = llmClient;
        this.protocol = protocol;
        this.errorTracker = errorTracker;
        this.retry = retry;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public CascadeResult call(List<ModelCandidate> candidates, InvocationRequest request) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one model candidate is required");
        }
        List<AttemptRecord> ledger = new ArrayList<>();
        int perModel = retry.retriesPerModel();

        cascade:
        for (ModelCandidate candidate : candidates) {
            for (int attempt = 1; attempt <= perModel; attempt++) {
                int attemptNumber = ledger.size() + 1;
                log.info("[FactCheck] Attempt {}: {} (retry {}/{})", attemptNumber, candidate.modelId(), attempt, perModel);

                AttemptRecord record = attempt(attemptNumber, candidate, request);
                ledger.add(record);

                if (record.parseSucceeded()) {
                    StructuredResult r = record.parsedResult();
                    log.info("[FactCheck] Success on attempt {} with {} - score={}, confidence={}",
                            attemptNumber, candidate.modelId(), r.score(), r.confidence());
                    return new CascadeResult(r, candidate.modelId(), List.copyOf(ledger));
                }

                log.warn("[FactCheck] Attempt {} failed with {} ({}): {}",
                        attemptNumber, candidate.modelId(), record.error().kind(), record.errorMessage());

                if (attempt == perModel) {
                    log.warn("[FactCheck] All retries exhausted for {}, trying next model if available", candidate.modelId());
                    break;
                }

                Duration wait = retry.backoffAfter(attempt);
                log.info("[FactCheck] Waiting {}ms before retry...", wait.toMillis());
                if (!pause(wait)) {
                    log.warn("[FactCheck] Interrupted during backoff; abandoning cascade");
                    break cascade;
                }
            }
        }

        ExhaustedCascadeException failure = new ExhaustedCascadeException(ledger);
        logLedger(failure);
        errorTracker.capture(failure, diagnostics(request, failure));
        throw failure;
    }

    private AttemptRecord attempt(int attemptNumber, ModelCandidate candidate, InvocationRequest request) {
        Instant at = clock.instant();
        String raw;
        try {
            raw = llmClient.complete(new LlmCall(
                    candidate.modelId(),
                    request.systemPrompt(),
                    request.userPrompt(),
                    request.temperature(),
                    candidate.maxTokens(),
                    candidate.timeout(),
                    retry.networkRetries()
            ));
        } catch (RuntimeException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new AttemptRecord(attemptNumber, candidate.modelId(), at, request.userPrompt(), null,
                    new AttemptError(AttemptError.Kind.TRANSPORT, msg), null);
        }

        ParseResult parsed = protocol.parse(raw);
        if (parsed instanceof ParseResult.Success s) {
            return new AttemptRecord(attemptNumber, candidate.modelId(), at, request.userPrompt(), raw, null, s.result());
        }
        AttemptError.Kind kind = parsed instanceof ParseResult.RangeInvalid
                ? AttemptError.Kind.RANGE_VALIDATION
                : AttemptError.Kind.PROTOCOL_PARSE;
        return new AttemptRecord(attemptNumber, candidate.modelId(), at, request.userPrompt(), raw,
                new AttemptError(kind, protocol.describeFailure(parsed, candidate.modelId())), null);
    }

    private boolean pause(Duration wait) {
        try {
            sleeper.sleep(wait);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void logLedger(ExhaustedCascadeException failure) {
        log.error("[FactCheck] {}", failure.getMessage());
        for (AttemptRecord a : failure.getAttempts()) {
            log.error("[FactCheck]   - Attempt {} ({}) at {}: {} | promptLength={}",
                    a.attemptNumber(), a.modelId(), a.timestamp(), a.errorMessage(),
                    a.prompt() == null ? 0 : a.prompt().length());
        }
    }

    private Map<String, Object> diagnostics(InvocationRequest request, ExhaustedCascadeException failure) {
        Map<String, Object> ctx = new LinkedHashMap<>(request.diagnostics());
        ctx.put("totalAttempts", failure.getAttemptCount());
        ctx.put("modelsAttempted", failure.getModelsAttempted());
        List<Map<String, Object>> attempts = new ArrayList<>();
        for (AttemptRecord a : failure.getAttempts()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("attemptNumber", a.attemptNumber());
            m.put("model", a.modelId());
            m.put("timestamp", a.timestamp().toString());
            m.put("errorKind", a.error() == null ? null : a.error().kind().name());
            m.put("error", a.errorMessage());
            m.put("parseSuccess", a.parseSucceeded());
            m.put("responseSample", TextUtils.truncate(a.rawResponse(), retry.maxResponseLogLength()));
            m.put("promptSample", TextUtils.truncate(a.prompt(), retry.maxPromptLogLength()));
            attempts.add(m);
        }
        ctx.put("attempts", attempts);
        return ctx;
    }
}
