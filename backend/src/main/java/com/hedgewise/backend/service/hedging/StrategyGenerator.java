package com.hedgewise.backend.service.hedging;

import com.hedgewise.backend.config.HedgingProperties;
import com.hedgewise.backend.model.CorrelationMatrix;
import com.hedgewise.backend.model.HedgeInstrument;
import com.hedgewise.backend.model.HedgingNeed;
import com.hedgewise.backend.model.InstrumentAllocation;
import com.hedgewise.backend.model.InstrumentType;
import com.hedgewise.backend.model.LiquidityTier;
import com.hedgewise.backend.model.Priority;
import com.hedgewise.backend.model.StrategyCandidate;
import com.hedgewise.backend.model.StrategyProfile;
import com.hedgewise.backend.model.StrategyType;
import com.hedgewise.backend.service.hedging.pricing.PricingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds hedging candidates from the instrument catalog: one per eligible need and instrument,
 * forward/option combinations for large high-priority needs, a portfolio swap basket, and
 * natural hedges between negatively correlated needs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyGenerator {

    private final HedgingProperties hedgingProperties;
    private final PricingProvider pricingProvider;

    public List<StrategyCandidate> generate(List<HedgingNeed> needs, CorrelationMatrix correlations,
                                            StrategyProfile profile) {
        List<HedgeInstrument> catalog = catalogFor(profile);
        List<StrategyCandidate> candidates = new ArrayList<>();
        for (HedgingNeed need : needs) {
            for (HedgeInstrument instrument : catalog) {
                singleInstrument(need, instrument).ifPresent(candidates::add);
            }
            combination(need, catalog).ifPresent(candidates::add);
        }
        basket(needs, catalog).ifPresent(candidates::add);
        candidates.addAll(naturalHedges(needs, correlations));
        log.debug("Generated {} candidates for {} needs", candidates.size(), needs.size());
        return candidates;
    }

    public List<HedgeInstrument> catalogFor(StrategyProfile profile) {
        if (profile == null) {
            return hedgingProperties.getInstruments();
        }
        HedgingProperties.Profile settings = hedgingProperties.getProfiles().get(profile);
        if (settings == null) {
            return hedgingProperties.getInstruments();
        }
        return hedgingProperties.getInstruments().stream()
                .filter(instrument -> settings.getInstrumentTypes().contains(instrument.getType()))
                .toList();
    }

    public Optional<StrategyCandidate> singleInstrument(HedgingNeed need, HedgeInstrument instrument) {
        if (!eligible(instrument, need.exposure(), need.timeHorizonDays())) {
            return Optional.empty();
        }
        double cost = pricingProvider.cost(instrument, need.exposure(), need.timeHorizonDays(), need.volatility());
        InstrumentAllocation allocation = new InstrumentAllocation(instrument.getType(), need.exposure(), 1.0,
                cost, instrument.getEffectiveness());
        return Optional.of(StrategyCandidate.builder()
                .id("single-" + need.currency() + "-" + instrument.getType().name().toLowerCase(Locale.ROOT))
                .type(StrategyType.SINGLE)
                .currencies(List.of(need.currency()))
                .exposure(need.exposure())
                .allocations(List.of(allocation))
                .hedgeRatio(need.recommendedHedgeRatio())
                .timeHorizonDays(need.timeHorizonDays())
                .totalCost(cost)
                .effectiveness(instrument.getEffectiveness())
                .liquidity(instrument.getLiquidity())
                .priority(need.priority())
                .riskContribution(need.riskContribution())
                .volatility(need.volatility())
                .build());
    }

    /**
     * Forward and option legs split by the configured forward portion. Returns empty when either
     * leg falls below its instrument minimum.
     */
    public Optional<StrategyCandidate> combination(HedgingNeed need, List<HedgeInstrument> catalog) {
        HedgingProperties.Combination config = hedgingProperties.getCombination();
        if (!config.isEnabled() || need.priority() != Priority.HIGH || need.exposure() <= config.getMinExposure()) {
            return Optional.empty();
        }
        Optional<HedgeInstrument> forward = find(catalog, InstrumentType.FORWARD_CONTRACT);
        Optional<HedgeInstrument> option = find(catalog, InstrumentType.CURRENCY_OPTION);
        if (forward.isEmpty() || option.isEmpty()) {
            return Optional.empty();
        }
        double forwardPortion = config.getForwardPortion();
        double forwardAmount = need.exposure() * forwardPortion;
        double optionAmount = need.exposure() - forwardAmount;
        if (!eligible(forward.get(), forwardAmount, need.timeHorizonDays())
                || !eligible(option.get(), optionAmount, need.timeHorizonDays())) {
            return Optional.empty();
        }
        InstrumentAllocation forwardLeg = leg(forward.get(), forwardAmount, forwardPortion, need);
        InstrumentAllocation optionLeg = leg(option.get(), optionAmount, 1.0 - forwardPortion, need);
        double effectiveness = forwardPortion * forwardLeg.effectiveness() + (1.0 - forwardPortion) * optionLeg.effectiveness();
        return Optional.of(StrategyCandidate.builder()
                .id("combination-" + need.currency())
                .type(StrategyType.COMBINATION)
                .currencies(List.of(need.currency()))
                .exposure(need.exposure())
                .allocations(List.of(forwardLeg, optionLeg))
                .hedgeRatio(need.recommendedHedgeRatio())
                .timeHorizonDays(need.timeHorizonDays())
                .totalCost(forwardLeg.cost() + optionLeg.cost())
                .effectiveness(effectiveness)
                .liquidity(LiquidityTier.worstOf(forward.get().getLiquidity(), option.get().getLiquidity()))
                .priority(need.priority())
                .riskContribution(need.riskContribution())
                .volatility(need.volatility())
                .build());
    }

    public Optional<StrategyCandidate> basket(List<HedgingNeed> needs, List<HedgeInstrument> catalog) {
        HedgingProperties.Basket config = hedgingProperties.getBasket();
        if (!config.isEnabled() || needs.size() < config.getMinNeeds()) {
            return Optional.empty();
        }
        Optional<HedgeInstrument> swap = find(catalog, InstrumentType.CURRENCY_SWAP);
        if (swap.isEmpty()) {
            return Optional.empty();
        }
        double total = needs.stream().mapToDouble(HedgingNeed::exposure).sum();
        int horizon = needs.stream().mapToInt(HedgingNeed::timeHorizonDays).min().orElse(0);
        if (total <= 0.0 || !eligible(swap.get(), total, horizon)) {
            return Optional.empty();
        }
        double ratio = needs.stream().mapToDouble(need -> need.recommendedHedgeRatio() * need.exposure()).sum() / total;
        double volatility = needs.stream().mapToDouble(need -> need.volatility() * need.exposure()).sum() / total;

        List<InstrumentAllocation> allocations = new ArrayList<>();
        double totalCost = 0.0;
        for (HedgingNeed need : needs) {
            double cost = pricingProvider.cost(swap.get(), need.exposure(), horizon, need.volatility())
                    * config.getCostMultiplier();
            allocations.add(new InstrumentAllocation(InstrumentType.CURRENCY_SWAP, need.exposure(),
                    need.exposure() / total, cost, config.getEffectiveness()));
            totalCost += cost;
        }
        List<String> currencies = needs.stream().map(HedgingNeed::currency).toList();
        return Optional.of(StrategyCandidate.builder()
                .id("basket-" + String.join("-", currencies))
                .type(StrategyType.BASKET)
                .currencies(currencies)
                .exposure(total)
                .allocations(allocations)
                .hedgeRatio(ratio)
                .timeHorizonDays(horizon)
                .totalCost(totalCost)
                .effectiveness(config.getEffectiveness())
                .liquidity(swap.get().getLiquidity())
                .priority(needs.stream().map(HedgingNeed::priority).min(Comparator.naturalOrder()).orElse(Priority.LOW))
                .riskContribution(needs.stream().mapToDouble(HedgingNeed::riskContribution).sum())
                .volatility(volatility)
                .build());
    }

    /**
     * Pairs are taken from the computed correlation matrix. The configured fallback pairs only
     * apply when a currency in the pair has no correlation data.
     */
    public List<StrategyCandidate> naturalHedges(List<HedgingNeed> needs, CorrelationMatrix correlations) {
        HedgingProperties.NaturalHedge config = hedgingProperties.getNaturalHedge();
        List<StrategyCandidate> candidates = new ArrayList<>();
        if (!config.isEnabled()) {
            return candidates;
        }
        Set<String> fallbackPairs = config.getFallbackPairs().stream()
                .map(pair -> pair.toUpperCase(Locale.ROOT))
                .collect(Collectors.toCollection(HashSet::new));
        for (int i = 0; i < needs.size(); i++) {
            for (int j = i + 1; j < needs.size(); j++) {
                HedgingNeed first = needs.get(i);
                HedgingNeed second = needs.get(j);
                boolean offsetting;
                if (correlations.hasData(first.currency(), second.currency())) {
                    offsetting = correlations.correlation(first.currency(), second.currency()) < config.getMaxCorrelation();
                } else {
                    offsetting = fallbackPairs.contains(first.currency() + "/" + second.currency())
                            || fallbackPairs.contains(second.currency() + "/" + first.currency());
                }
                if (offsetting) {
                    candidates.add(naturalHedge(first, second, config.getEffectiveness()));
                }
            }
        }
        return candidates;
    }

    private StrategyCandidate naturalHedge(HedgingNeed first, HedgingNeed second, double effectiveness) {
        HedgingNeed larger = first.exposure() >= second.exposure() ? first : second;
        HedgingNeed smaller = larger == first ? second : first;
        double ratio = larger.exposure() > 0.0 ? smaller.exposure() / larger.exposure() : 0.0;
        return StrategyCandidate.builder()
                .id("natural-" + larger.currency() + "-" + smaller.currency())
                .type(StrategyType.NATURAL)
                .currencies(List.of(larger.currency(), smaller.currency()))
                .exposure(larger.exposure())
                .allocations(List.of())
                .hedgeRatio(ratio)
                .timeHorizonDays(Math.min(first.timeHorizonDays(), second.timeHorizonDays()))
                .totalCost(0.0)
                .effectiveness(effectiveness)
                .liquidity(LiquidityTier.HIGH)
                .priority(first.priority().compareTo(second.priority()) <= 0 ? first.priority() : second.priority())
                .riskContribution(larger.riskContribution())
                .volatility(larger.volatility())
                .build();
    }

    private InstrumentAllocation leg(HedgeInstrument instrument, double amount, double portion, HedgingNeed need) {
        double cost = pricingProvider.cost(instrument, amount, need.timeHorizonDays(), need.volatility());
        return new InstrumentAllocation(instrument.getType(), amount, portion, cost, instrument.getEffectiveness());
    }

    private static boolean eligible(HedgeInstrument instrument, double amount, int horizonDays) {
        return instrument.getMinimumAmount() <= amount && instrument.getMaximumTenorDays() >= horizonDays;
    }

    private static Optional<HedgeInstrument> find(List<HedgeInstrument> catalog, InstrumentType type) {
        return catalog.stream().filter(instrument -> instrument.getType() == type).findFirst();
    }
}
