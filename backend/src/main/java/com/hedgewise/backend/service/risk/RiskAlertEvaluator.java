package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.config.RiskProperties;
import com.hedgewise.backend.event.RiskAlert;
import com.hedgewise.backend.model.Priority;
import com.hedgewise.backend.model.RiskAssessment;
import com.hedgewise.backend.model.VarResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class RiskAlertEvaluator {

    private static final double ALERT_CONFIDENCE = 0.95;

    private final RiskProperties riskProperties;

    public List<RiskAlert> evaluate(RiskAssessment assessment) {
        RiskProperties.Alerts config = riskProperties.getAlerts();
        List<RiskAlert> alerts = new ArrayList<>();
        if (!config.isEnabled()) {
            return alerts;
        }
        Instant now = Instant.now();

        double var95 = assessment.varAt(ALERT_CONFIDENCE).map(VarResult::parametric).orElse(0.0);
        if (var95 > config.getVarThreshold()) {
            alerts.add(new RiskAlert(RiskAlert.AlertType.VAR_THRESHOLD, Priority.HIGH, assessment.getUserId(),
                    String.format(Locale.ROOT, "95%% VaR %.2f %s exceeds %.2f",
                            var95, assessment.getBaseCurrency(), config.getVarThreshold()),
                    var95, config.getVarThreshold(), now));
        }

        double maxConcentration = assessment.getConcentration().maxConcentration();
        if (maxConcentration > config.getConcentrationThreshold()) {
            alerts.add(new RiskAlert(RiskAlert.AlertType.CONCENTRATION, Priority.MEDIUM, assessment.getUserId(),
                    String.format(Locale.ROOT, "High concentration risk: %.1f%% in a single currency",
                            maxConcentration * 100.0),
                    maxConcentration, config.getConcentrationThreshold(), now));
        }
        return alerts;
    }
}
