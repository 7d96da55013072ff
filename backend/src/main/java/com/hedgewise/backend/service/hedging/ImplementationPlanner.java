package com.hedgewise.backend.service.hedging;

import com.hedgewise.backend.model.ImplementationPhase;
import com.hedgewise.backend.model.ImplementationPlan;
import com.hedgewise.backend.model.InstrumentAllocation;
import com.hedgewise.backend.model.InstrumentType;
import com.hedgewise.backend.model.StrategyCandidate;
import com.hedgewise.backend.model.StrategyType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class ImplementationPlanner {

    static final double LARGE_NOTIONAL = 1_000_000.0;

    static final List<String> MONITORING_METRICS = List.of(
            "Hedge effectiveness",
            "Mark-to-market P&L",
            "Basis tracking",
            "Correlation stability"
    );

    public ImplementationPlan plan(StrategyCandidate strategy) {
        List<ImplementationPhase> phases = List.of(
                new ImplementationPhase("Preparation", 2,
                        List.of("Confirm exposure figures with treasury",
                                "Obtain counterparty quotes",
                                "Approve hedge ratio and budget"),
                        List.of("Approved hedging mandate", "Counterparty quote comparison")),
                new ImplementationPhase("Initial execution", 1,
                        List.of("Execute hedge instruments", "Confirm trade details with counterparties"),
                        List.of("Trade confirmations", "Updated hedge register")),
                new ImplementationPhase("Ongoing monitoring", Math.max(1, strategy.getTimeHorizonDays()),
                        List.of("Track hedge effectiveness", "Revalue positions", "Review rollover or unwind triggers"),
                        List.of("Monthly effectiveness report", "Rollover decision at maturity"))
        );
        return new ImplementationPlan(strategy.getId(), phases, prerequisites(strategy), risks(strategy),
                MONITORING_METRICS);
    }

    private static List<String> prerequisites(StrategyCandidate strategy) {
        List<String> prerequisites = new ArrayList<>();
        prerequisites.add("Approved hedging policy");
        if (strategy.getType() == StrategyType.NATURAL) {
            prerequisites.add("Verified timing of offsetting cash flows in " + String.join(" and ", strategy.getCurrencies()));
            return prerequisites;
        }
        prerequisites.add("Master agreements with trading counterparties");
        if (strategy.getExposure() * strategy.getHedgeRatio() > LARGE_NOTIONAL) {
            prerequisites.add("Treasury committee sign-off for notional above " + (long) LARGE_NOTIONAL);
        }
        if (uses(strategy, InstrumentType.CURRENCY_OPTION)) {
            prerequisites.add("Options trading authorisation");
        }
        if (strategy.getType() == StrategyType.BASKET) {
            prerequisites.add("Swap documentation covering every basket currency");
        }
        return prerequisites;
    }

    private static List<String> risks(StrategyCandidate strategy) {
        List<String> risks = new ArrayList<>();
        switch (strategy.getType()) {
            case NATURAL -> risks.add("Correlation breakdown between offsetting currencies");
            case BASKET -> risks.add("Basis risk from imperfect correlation across basket currencies");
            default -> risks.add("Counterparty credit risk");
        }
        if (strategy.getHedgeRatio() < 1.0) {
            risks.add("Residual unhedged exposure");
        }
        if (uses(strategy, InstrumentType.CURRENCY_OPTION)) {
            risks.add("Premium paid is lost if the option expires out of the money");
        }
        return risks;
    }

    private static boolean uses(StrategyCandidate strategy, InstrumentType type) {
        return strategy.getAllocations().stream().map(InstrumentAllocation::instrument).anyMatch(type::equals);
    }
}
