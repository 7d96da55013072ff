package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.config.RiskProperties;
import com.hedgewise.backend.model.RiskAssessment;
import com.hedgewise.backend.service.RiskEventDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Periodically tells listeners which cached assessments have outlived the update interval.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskStalenessMonitor {

    private final RiskAssessmentCache assessmentCache;
    private final RiskEventDispatcher eventDispatcher;
    private final RiskProperties riskProperties;

    @Scheduled(fixedDelayString = "${risk.staleness.max-age-ms:300000}")
    public void checkStaleness() {
        checkStaleness(Instant.now());
    }

    public List<String> checkStaleness(Instant now) {
        List<String> stale = new ArrayList<>();
        RiskProperties.Staleness config = riskProperties.getStaleness();
        if (!config.isEnabled()) {
            return stale;
        }
        Duration maxAge = Duration.ofMillis(config.getMaxAgeMs());
        for (Map.Entry<String, RiskAssessment> entry : assessmentCache.snapshot().entrySet()) {
            Instant calculated = entry.getValue().getTimestamp();
            if (Duration.between(calculated, now).compareTo(maxAge) > 0) {
                stale.add(entry.getKey());
                eventDispatcher.riskUpdateRequired(entry.getKey(), calculated);
            }
        }
        if (!stale.isEmpty()) {
            log.debug("{} cached assessments need a refresh", stale.size());
        }
        return stale;
    }
}
