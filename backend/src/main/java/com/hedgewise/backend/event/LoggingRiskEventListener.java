package com.hedgewise.backend.event;

import com.hedgewise.backend.model.HedgingRecommendation;
import com.hedgewise.backend.model.RiskAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Slf4j
@Component
public class LoggingRiskEventListener implements RiskEventListener {

    @Override
    public void onRiskCalculated(RiskAssessment assessment) {
        log.debug("Risk calculated for user {} score={}", assessment.getUserId(), assessment.getRiskScore());
    }

    @Override
    public void onRiskAlert(RiskAlert alert) {
        log.warn("Risk alert {} ({}) for user {}: {}", alert.type(), alert.severity(), alert.userId(), alert.message());
    }

    @Override
    public void onStrategiesGenerated(HedgingRecommendation recommendation) {
        log.debug("{} strategies generated for user {}", recommendation.getStrategies().size(),
                recommendation.getUserId());
    }

    @Override
    public void onRiskUpdateRequired(String userId, Instant lastCalculated) {
        log.info("Risk assessment for user {} is stale (last calculated {})", userId, lastCalculated);
    }
}
