package com.hedgewise.backend.service.hedging;

import com.hedgewise.backend.config.HedgingProperties;
import com.hedgewise.backend.model.CurrencyExposure;
import com.hedgewise.backend.model.HedgingNeed;
import com.hedgewise.backend.model.Priority;
import com.hedgewise.backend.model.RiskAssessment;
import com.hedgewise.backend.model.Urgency;
import com.hedgewise.backend.model.VolatilityProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decides which exposures need hedging. Rules apply in order: concentration at or above the high
 * threshold, then annual volatility above the medium threshold, then either measure above the low
 * thresholds. Exposures matching none are left unhedged.
 */
@Service
@RequiredArgsConstructor
public class HedgingNeedAnalyzer {

    private final HedgingProperties hedgingProperties;

    public List<HedgingNeed> analyze(RiskAssessment assessment) {
        List<HedgingNeed> needs = new ArrayList<>();
        for (CurrencyExposure exposure : assessment.getExposures()) {
            VolatilityProfile profile = assessment.getVolatilities().get(exposure.currency());
            double volatility = profile == null ? 0.0 : profile.annual();
            double riskContribution = profile == null ? 0.0 : exposure.exposure() * profile.daily();
            evaluate(exposure, volatility, riskContribution).ifPresent(needs::add);
        }
        needs.sort(Comparator.comparing(HedgingNeed::priority)
                .thenComparing(Comparator.comparingDouble(HedgingNeed::riskContribution).reversed())
                .thenComparing(HedgingNeed::currency));
        return needs;
    }

    public Optional<HedgingNeed> evaluate(CurrencyExposure exposure, double volatility, double riskContribution) {
        HedgingProperties.Needs rules = hedgingProperties.getNeeds();
        double concentration = exposure.relativeExposure();

        Priority priority;
        double ratio;
        int horizon;
        if (concentration >= rules.getHighConcentration()) {
            priority = Priority.HIGH;
            ratio = Math.min(rules.getHighMaxRatio(), rules.getHighRatioMultiplier() * concentration);
            horizon = rules.getHighHorizonDays();
        } else if (volatility > rules.getMediumVolatility()) {
            priority = Priority.MEDIUM;
            ratio = Math.min(rules.getMediumMaxRatio(), rules.getMediumRatioMultiplier() * volatility);
            horizon = rules.getMediumHorizonDays();
        } else if (concentration > rules.getLowConcentration() || volatility > rules.getLowVolatility()) {
            priority = Priority.LOW;
            ratio = Math.min(rules.getLowMaxRatio(), rules.getLowRatioMultiplier() * Math.max(concentration, volatility));
            horizon = rules.getLowHorizonDays();
        } else {
            return Optional.empty();
        }
        ratio = Math.max(0.0, Math.min(1.0, ratio));
        return Optional.of(new HedgingNeed(exposure.currency(), exposure.exposure(), concentration, priority,
                riskContribution, volatility, ratio, horizon, Urgency.forPriority(priority)));
    }
}
