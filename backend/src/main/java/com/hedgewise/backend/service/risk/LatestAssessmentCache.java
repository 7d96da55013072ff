package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.model.RiskAssessment;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps only the most recent assessment per user; a put replaces the previous entry.
 */
@Component
public class LatestAssessmentCache implements RiskAssessmentCache {

    private final Map<String, RiskAssessment> latest = new ConcurrentHashMap<>();

    @Override
    public Optional<RiskAssessment> get(String userId) {
        return Optional.ofNullable(latest.get(userId));
    }

    @Override
    public void put(RiskAssessment assessment) {
        latest.put(assessment.getUserId(), assessment);
    }

    @Override
    public void evict(String userId) {
        latest.remove(userId);
    }

    @Override
    public Map<String, RiskAssessment> snapshot() {
        return Map.copyOf(latest);
    }
}
