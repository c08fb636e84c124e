package com.goormthonuniv.factcheck.controller;

import com.goormthonuniv.factcheck.config.FactCheckProperties;
import com.goormthonuniv.factcheck.exception.GlobalExceptionHandler;
import com.goormthonuniv.factcheck.resilience.CircuitBreaker;
import com.goormthonuniv.factcheck.resilience.CircuitBreakerRegistry;
import com.goormthonuniv.factcheck.resilience.CircuitState;
import com.goormthonuniv.factcheck.resilience.MutableClock;
import com.goormthonuniv.factcheck.resilience.OperationClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class CircuitBreakerControllerTest {

    private CircuitBreakerRegistry registry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        registry = new CircuitBreakerRegistry(Map.of(), new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));
        mockMvc = MockMvcBuilders.standaloneSetup(new CircuitBreakerController(registry))
                .setControllerAdvice(new GlobalExceptionHandler(new FactCheckProperties()))
                .build();
    }

    private void trip(CircuitBreaker breaker, int failures) {
        for (int i = 0; i < failures; i++) {
            assertThrows(IllegalStateException.class, () -> breaker.execute(() -> {
                throw new IllegalStateException("down");
            }));
        }
    }

    @Test
    void list_returnsEveryOperationClass() throws Exception {
        trip(registry.get(OperationClass.QUICK_RUN), 2);

        mockMvc.perform(get("/api/v1/circuit-breakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(OperationClass.values().length))
                .andExpect(jsonPath("$[?(@.operationClass == 'quick-run')].state").value("OPEN"))
                .andExpect(jsonPath("$[?(@.operationClass == 'fact-check')].state").value("CLOSED"));
    }

    @Test
    void reset_closesTrippedBreaker() throws Exception {
        CircuitBreaker factCheck = registry.get(OperationClass.FACT_CHECK);
        trip(factCheck, 3);
        assertEquals(CircuitState.OPEN, factCheck.getState().state());

        mockMvc.perform(post("/api/v1/circuit-breakers/fact-check/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("CLOSED"))
                .andExpect(jsonPath("$.consecutiveFailures").value(0));

        assertEquals(CircuitState.CLOSED, factCheck.getState().state());
    }

    @Test
    void reset_unknownOperationClassIs404() throws Exception {
        mockMvc.perform(post("/api/v1/circuit-breakers/payments/reset"))
                .andExpect(status().isNotFound());
    }
}
