package com.goormthonuniv.factcheck.exception;

import com.goormthonuniv.factcheck.auth.BackgroundAuthException;
import com.goormthonuniv.factcheck.config.FactCheckProperties;
import com.goormthonuniv.factcheck.resilience.CircuitOpenException;
import com.goormthonuniv.factcheck.resilience.ExhaustedCascadeException;
import jakarta.servlet.ServletException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 사용자에게는 고정된 짧은 메시지만. 시도 원장 같은 진단 정보는 에러 트래커로만 간다.
 * stack trace 는 include-error-details=true(dev) 일 때만 details 로 내려준다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final boolean includeErrorDetails;

    public GlobalExceptionHandler(FactCheckProperties properties) {
        this.includeErrorDetails = properties.getHttp().isIncludeErrorDetails();
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", "VALIDATION_ERROR",
                "message", e.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + " " + fe.getDefaultMessage()).toList()
        ));
    }

    @ExceptionHandler(FactCheckValidationException.class)
    public ResponseEntity<?> handleFactCheckValidation(FactCheckValidationException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", "VALIDATION_ERROR",
                "message", e.getMessage()
        ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<?> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", "VALIDATION_ERROR",
                "message", "Request body is required and must be valid JSON"
        ));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<?> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e) {
        Set<HttpMethod> allowed = e.getSupportedHttpMethods();
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .allow(allowed == null ? new HttpMethod[0] : allowed.toArray(new HttpMethod[0]))
                .body(Map.of(
                        "error", "METHOD_NOT_ALLOWED",
                        "message", "Method not allowed. This endpoint only accepts "
                                + (allowed == null ? "other" : allowed.toString()) + " requests."
                ));
    }

    @ExceptionHandler(BackgroundAuthException.class)
    public ResponseEntity<?> handleBackgroundAuth(BackgroundAuthException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of(
                "error", "UNAUTHORIZED",
                "message", e.getMessage()
        ));
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<?> handleCircuitOpen(CircuitOpenException e) {
        long retryAfterSeconds = Math.max(1, (e.getRetryAfter().toMillis() + 999) / 1000);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(Map.of(
                        "error", "CIRCUIT_OPEN",
                        "message", "Fact-check is temporarily unavailable. Please retry later."
                ));
    }

    /** 415, 404, 406 등 MVC 가 만든 클라이언트 오류는 원래 상태 코드 그대로 */
    @ExceptionHandler({ServletException.class, ErrorResponseException.class})
    public ResponseEntity<?> handleFramework(Exception e) {
        if (e instanceof ErrorResponse er && er.getStatusCode().is4xxClientError()) {
            HttpStatus status = HttpStatus.valueOf(er.getStatusCode().value());
            String detail = er.getBody().getDetail();
            log.debug("[FactCheck] Rejected request ({}): {}", status.value(), e.getMessage());
            return ResponseEntity.status(status)
                    .headers(er.getHeaders())
                    .body(Map.of(
                            "error", status.name(),
                            "message", detail != null ? detail : status.getReasonPhrase()
                    ));
        }
        return handleGeneric(e);
    }

    @ExceptionHandler(ExhaustedCascadeException.class)
    public ResponseEntity<?> handleExhausted(ExhaustedCascadeException e) {
        return failure("FACTCHECK_FAILED", "Fact-check failed: " + e.getMessage(), e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleGeneric(Exception e) {
        log.error("[FactCheck] Handler error: {}", e.getMessage(), e);
        return failure("INTERNAL_ERROR", "Fact-check failed: Unknown error", e);
    }

    private ResponseEntity<?> failure(String code, String message, Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        if (includeErrorDetails) {
            body.put("details", ExceptionUtils.getStackTrace(e));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
