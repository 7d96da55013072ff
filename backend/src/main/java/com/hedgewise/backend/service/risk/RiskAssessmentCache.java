package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.model.RiskAssessment;

import java.util.Map;
import java.util.Optional;

/**
 * Holds risk assessments per user.
 */
public interface RiskAssessmentCache {

    Optional<RiskAssessment> get(String userId);

    void put(RiskAssessment assessment);

    void evict(String userId);

    Map<String, RiskAssessment> snapshot();
}
