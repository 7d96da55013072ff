package com.hedgewise.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class MarketDataResilienceConfig {

    @Bean
    public CircuitBreaker marketDataCircuitBreaker(MarketDataProperties properties) {
        MarketDataProperties.Resilience resilience = properties.getResilience();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(resilience.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(resilience.getWaitOpenSeconds()))
                .slidingWindowSize(resilience.getSlidingWindowSize())
                .build();
        return CircuitBreaker.of("market-data", config);
    }
}
