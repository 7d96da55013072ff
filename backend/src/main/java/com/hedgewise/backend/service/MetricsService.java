package com.hedgewise.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicReference<Double> lastRiskScore = new AtomicReference<>(0.0);

    private Counter assessmentsCounter;
    private Counter assessmentFailuresCounter;
    private Counter volatilityFallbacksCounter;
    private Counter recommendationsCounter;
    private Counter alertsCounter;
    private Timer monteCarloTimer;
    private Timer optimizationTimer;

    @jakarta.annotation.PostConstruct
    void init() {
        assessmentsCounter = Counter.builder("risk_assessments_total").register(meterRegistry);
        assessmentFailuresCounter = Counter.builder("risk_assessment_failures_total").register(meterRegistry);
        volatilityFallbacksCounter = Counter.builder("volatility_fallbacks_total").register(meterRegistry);
        recommendationsCounter = Counter.builder("hedging_recommendations_total").register(meterRegistry);
        alertsCounter = Counter.builder("risk_alerts_total").register(meterRegistry);
        monteCarloTimer = Timer.builder("monte_carlo_duration").register(meterRegistry);
        optimizationTimer = Timer.builder("hedge_optimization_duration").register(meterRegistry);
        Gauge.builder("risk_score_last", lastRiskScore, value -> value.get()).register(meterRegistry);
    }

    public void recordAssessment(double riskScore) {
        lastRiskScore.set(riskScore);
        if (assessmentsCounter != null) {
            assessmentsCounter.increment();
        }
    }

    public void recordAssessmentFailure() {
        if (assessmentFailuresCounter != null) {
            assessmentFailuresCounter.increment();
        }
    }

    public void recordVolatilityFallback() {
        if (volatilityFallbacksCounter != null) {
            volatilityFallbacksCounter.increment();
        }
    }

    public void recordRecommendation() {
        if (recommendationsCounter != null) {
            recommendationsCounter.increment();
        }
    }

    public void recordAlert() {
        if (alertsCounter != null) {
            alertsCounter.increment();
        }
    }

    public void recordMonteCarlo(Duration duration) {
        if (monteCarloTimer != null) {
            monteCarloTimer.record(duration);
        }
    }

    public void recordOptimization(Duration duration) {
        if (optimizationTimer != null) {
            optimizationTimer.record(duration);
        }
    }
}
