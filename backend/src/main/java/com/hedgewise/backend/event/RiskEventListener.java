package com.hedgewise.backend.event;

import com.hedgewise.backend.model.HedgingRecommendation;
import com.hedgewise.backend.model.RiskAssessment;

import java.time.Instant;

/**
 * Observer for risk and hedging results. Implementations registered as beans are picked up
 * automatically; others can be added through {@code RiskEventDispatcher#register}.
 * Callbacks run on the calculating thread and must not block.
 */
public interface RiskEventListener {

    default void onRiskCalculated(RiskAssessment assessment) {
    }

    default void onRiskAlert(RiskAlert alert) {
    }

    default void onStrategiesGenerated(HedgingRecommendation recommendation) {
    }

    default void onRiskUpdateRequired(String userId, Instant lastCalculated) {
    }
}
