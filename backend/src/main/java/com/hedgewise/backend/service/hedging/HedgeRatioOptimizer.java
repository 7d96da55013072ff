package com.hedgewise.backend.service.hedging;

import com.hedgewise.backend.config.HedgingProperties;
import com.hedgewise.backend.model.OptimizationResult;
import com.hedgewise.backend.model.StrategyCandidate;
import com.hedgewise.backend.service.MetricsService;
import com.hedgewise.backend.util.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Tunes each candidate's hedge ratio within bounds: a coarse grid pass followed by finite-difference
 * gradient ascent. Candidates are optimised concurrently. Natural hedges keep their structural ratio,
 * clamped into bounds.
 */
@Slf4j
@Service
public class HedgeRatioOptimizer {

    private static final String OPERATION = "hedge-optimization";

    private final HedgingProperties hedgingProperties;
    private final Executor executor;
    private final MetricsService metricsService;

    public HedgeRatioOptimizer(HedgingProperties hedgingProperties,
                               @Qualifier("optimizerExecutor") Executor executor,
                               MetricsService metricsService) {
        this.hedgingProperties = hedgingProperties;
        this.executor = executor;
        this.metricsService = metricsService;
    }

    public List<OptimizationResult> optimizeAll(List<StrategyCandidate> candidates, Bounds bounds,
                                                CancellationToken token) {
        long started = System.nanoTime();
        List<CompletableFuture<OptimizationResult>> futures = candidates.stream()
                .map(candidate -> CompletableFuture.supplyAsync(() -> optimize(candidate, bounds, token), executor))
                .toList();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        metricsService.recordOptimization(Duration.ofNanos(System.nanoTime() - started));
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public OptimizationResult optimize(StrategyCandidate candidate, Bounds bounds, CancellationToken token) {
        HedgingProperties.Optimizer config = hedgingProperties.getOptimizer();
        double initial = candidate.getHedgeRatio();
        if (candidate.isNatural()) {
            double ratio = bounds.clamp(initial);
            return new OptimizationResult(candidate.withHedgeRatio(ratio), initial, ratio,
                    utility(candidate, ratio), 0, true);
        }

        double bestRatio = bounds.min();
        double bestUtility = utility(candidate, bestRatio);
        for (double ratio = bounds.min() + config.getGridStep(); ratio <= bounds.max() + 1e-12; ratio += config.getGridStep()) {
            double clamped = bounds.clamp(ratio);
            double value = utility(candidate, clamped);
            if (value > bestUtility) {
                bestUtility = value;
                bestRatio = clamped;
            }
        }
        double upper = utility(candidate, bounds.max());
        if (upper > bestUtility) {
            bestUtility = upper;
            bestRatio = bounds.max();
        }

        double ratio = bestRatio;
        double epsilon = config.getEpsilon();
        boolean converged = false;
        int iterations = 0;
        while (iterations < config.getMaxIterations()) {
            token.throwIfCancelled(OPERATION);
            iterations++;
            double gradient = (utility(candidate, bounds.clamp(ratio + epsilon))
                    - utility(candidate, bounds.clamp(ratio - epsilon))) / (2.0 * epsilon);
            double next = bounds.clamp(ratio + config.getLearningRate() * gradient);
            double value = utility(candidate, next);
            if (value > bestUtility) {
                bestUtility = value;
                bestRatio = next;
            }
            if (Math.abs(next - ratio) < config.getConvergenceThreshold()) {
                converged = true;
                break;
            }
            ratio = next;
        }
        if (!converged) {
            log.debug("Optimization of {} stopped after {} iterations without converging", candidate.getId(), iterations);
        }
        return new OptimizationResult(candidate.withHedgeRatio(bestRatio), initial, bestRatio, bestUtility,
                iterations, converged);
    }

    /**
     * 0.6 x risk reduction + 0.3 x cost score + 0.1 x effectiveness - moderation penalty, with the
     * weights taken from configuration.
     */
    public double utility(StrategyCandidate candidate, double ratio) {
        HedgingProperties.Optimizer config = hedgingProperties.getOptimizer();
        double effectiveness = candidate.getEffectiveness();
        double riskReduction = ratio * effectiveness;
        double costFraction = candidate.getExposure() > 0.0 ? candidate.costAt(ratio) / candidate.getExposure() : 0.0;
        double costScore = Math.max(0.0, Math.min(1.0, 1.0 - costFraction / config.getCostNormalization()));
        double penalty = config.getModerationPenalty() * Math.abs(ratio - 0.5);
        return config.getRiskReductionWeight() * riskReduction
                + config.getCostWeight() * costScore
                + config.getEffectivenessWeight() * effectiveness
                - penalty;
    }

    /**
     * Configured ratio range, narrowed by a strategy profile when one is given.
     */
    public Bounds bounds(HedgingProperties.Profile profile) {
        HedgingProperties.Optimizer config = hedgingProperties.getOptimizer();
        double min = Math.min(config.getMinRatio(), config.getMaxRatio());
        double max = Math.max(config.getMinRatio(), config.getMaxRatio());
        if (profile != null) {
            double narrowedMin = Math.max(min, profile.getMinRatio());
            double narrowedMax = Math.min(max, profile.getMaxRatio());
            if (narrowedMin <= narrowedMax) {
                return new Bounds(narrowedMin, narrowedMax);
            }
            log.warn("Profile ratio range [{}, {}] lies outside [{}, {}], ignoring it",
                    profile.getMinRatio(), profile.getMaxRatio(), min, max);
        }
        return new Bounds(min, max);
    }

    public record Bounds(double min, double max) {

        public double clamp(double ratio) {
            return Math.max(min, Math.min(max, ratio));
        }
    }
}
