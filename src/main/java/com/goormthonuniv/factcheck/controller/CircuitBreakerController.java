package com.goormthonuniv.factcheck.controller;

import com.goormthonuniv.factcheck.resilience.CircuitBreakerRegistry;
import com.goormthonuniv.factcheck.resilience.CircuitBreakerSnapshot;
import com.goormthonuniv.factcheck.resilience.OperationClass;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/circuit-breakers")
@RequiredArgsConstructor
public class CircuitBreakerController {

    private final CircuitBreakerRegistry registry;

    @Operation(summary = "operation class 별 브레이커 상태 조회")
    @GetMapping
    public List<CircuitBreakerSnapshot> list() {
        return registry.snapshots();
    }

    @Operation(summary = "브레이커 수동 리셋(CLOSED)")
    @PostMapping("/{operationClass}/reset")
    public ResponseEntity<CircuitBreakerSnapshot> reset(@PathVariable String operationClass) {
        return OperationClass.fromKey(operationClass)
                .map(registry::get)
                .map(cb -> {
                    cb.reset();
                    return ResponseEntity.ok(cb.getState());
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
