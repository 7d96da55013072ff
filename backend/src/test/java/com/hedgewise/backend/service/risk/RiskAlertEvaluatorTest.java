package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.config.RiskProperties;
import com.hedgewise.backend.event.RiskAlert;
import com.hedgewise.backend.model.CorrelationMatrix;
import com.hedgewise.backend.model.Priority;
import com.hedgewise.backend.model.RiskAssessment;
import com.hedgewise.backend.util.RiskFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RiskAlertEvaluatorTest {

    private static RiskAssessment assessment(double var95) {
        return RiskFixtures.assessment("user-1",
                List.of(RiskFixtures.exposure("EUR", 500_000, 1.0)),
                RiskFixtures.annualVolatilities(Map.of("EUR", 0.1)),
                CorrelationMatrix.empty(),
                var95);
    }

    @Test
    void raisesVarAlertAboveThreshold() {
        RiskProperties properties = new RiskProperties();

        List<RiskAlert> alerts = new RiskAlertEvaluator(properties).evaluate(assessment(150_000));

        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.type()).isEqualTo(RiskAlert.AlertType.VAR_THRESHOLD);
            assertThat(alert.severity()).isEqualTo(Priority.HIGH);
            assertThat(alert.value()).isEqualTo(150_000.0);
            assertThat(alert.threshold()).isEqualTo(100_000.0);
            assertThat(alert.message()).isEqualTo("95% VaR 150000.00 USD exceeds 100000.00");
        });
    }

    @Test
    void staysQuietAtOrBelowThreshold() {
        assertThat(new RiskAlertEvaluator(new RiskProperties()).evaluate(assessment(100_000))).isEmpty();
    }

    @Test
    void disabledAlertsNeverFire() {
        RiskProperties properties = new RiskProperties();
        properties.getAlerts().setEnabled(false);

        assertThat(new RiskAlertEvaluator(properties).evaluate(assessment(1_000_000))).isEmpty();
    }
}
