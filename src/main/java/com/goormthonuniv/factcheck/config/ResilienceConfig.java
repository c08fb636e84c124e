package com.goormthonuniv.factcheck.config;

import com.goormthonuniv.factcheck.llm.LlmClient;
import com.goormthonuniv.factcheck.protocol.StructuredResponseProtocol;
import com.goormthonuniv.factcheck.resilience.CircuitBreakerRegistry;
import com.goormthonuniv.factcheck.resilience.ResilientInvoker;
import com.goormthonuniv.factcheck.resilience.Sleeper;
import com.goormthonuniv.factcheck.tracking.ErrorTracker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    /** 프로세스 전체에서 하나. operation class 별 브레이커 상태를 모든 요청이 공유 */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(FactCheckProperties properties, Clock clock) {
        return new CircuitBreakerRegistry(properties.breakerOverrides(), clock);
    }

    @Bean
    public ResilientInvoker resilientInvoker(LlmClient llmClient,
                                             StructuredResponseProtocol protocol,
                                             ErrorTracker errorTracker,
                                             FactCheckProperties properties,
                                             Sleeper sleeper,
                                             Clock clock) {
        return new ResilientInvoker(llmClient, protocol, errorTracker, properties.retrySettings(), sleeper, clock);
    }
}
