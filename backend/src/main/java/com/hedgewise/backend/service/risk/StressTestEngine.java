package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.config.RiskProperties;
import com.hedgewise.backend.model.CurrencyExposure;
import com.hedgewise.backend.model.Severity;
import com.hedgewise.backend.model.StressTestResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the configured historical shock scenarios. Loss counts the shock magnitude
 * regardless of its sign.
 */
@Service
@RequiredArgsConstructor
public class StressTestEngine {

    private final RiskProperties riskProperties;

    public List<StressTestResult> run(List<CurrencyExposure> exposures, double totalExposure) {
        List<StressTestResult> results = new ArrayList<>();
        for (RiskProperties.StressScenario scenario : riskProperties.getStressScenarios()) {
            Map<String, Double> losses = new LinkedHashMap<>();
            double total = 0.0;
            for (CurrencyExposure exposure : exposures) {
                Double shock = scenario.getShocks().get(exposure.currency());
                if (shock == null) {
                    continue;
                }
                double loss = exposure.exposure() * Math.abs(shock);
                losses.put(exposure.currency(), loss);
                total += loss;
            }
            double fraction = totalExposure > 0.0 ? total / totalExposure : 0.0;
            results.add(new StressTestResult(scenario.getName(), total, fraction, Severity.forLossFraction(fraction), losses));
        }
        results.sort(Comparator.comparingDouble(StressTestResult::totalLoss).reversed()
                .thenComparing(StressTestResult::scenario));
        return results;
    }
}
