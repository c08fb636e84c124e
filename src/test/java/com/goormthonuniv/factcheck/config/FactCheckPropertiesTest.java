package com.goormthonuniv.factcheck.config;

import com.goormthonuniv.factcheck.resilience.BackoffStrategy;
import com.goormthonuniv.factcheck.resilience.CircuitBreakerSettings;
import com.goormthonuniv.factcheck.resilience.OperationClass;
import com.goormthonuniv.factcheck.resilience.RetrySettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FactCheckPropertiesTest {

    @Test
    void breakerOverrides_partialEntryKeepsDefaultForMissingField() {
        FactCheckProperties p = new FactCheckProperties();
        FactCheckProperties.BreakerProperties chat = new FactCheckProperties.BreakerProperties();
        chat.setFailureThreshold(5);
        p.getCircuitBreakers().put("chat", chat);

        Map<OperationClass, CircuitBreakerSettings> overrides = p.breakerOverrides();

        assertEquals(1, overrides.size());
        assertEquals(5, overrides.get(OperationClass.CHAT).failureThreshold());
        assertEquals(OperationClass.CHAT.defaults().resetTimeout(), overrides.get(OperationClass.CHAT).resetTimeout());
    }

    @Test
    void breakerOverrides_unknownKeyFailsFast() {
        FactCheckProperties p = new FactCheckProperties();
        p.getCircuitBreakers().put("payments", new FactCheckProperties.BreakerProperties());

        assertThrows(IllegalArgumentException.class, p::breakerOverrides);
    }

    @Test
    void retrySettings_defaults() {
        RetrySettings r = new FactCheckProperties().retrySettings();

        assertEquals(2, r.retriesPerModel());
        assertEquals(1, r.networkRetries());
        assertEquals(BackoffStrategy.LINEAR, r.backoffStrategy());
        assertEquals(Duration.ofMillis(2000), r.backoffAfter(2));
    }
}
