package com.hedgewise.backend.service.risk;

import com.hedgewise.backend.config.RiskProperties;
import com.hedgewise.backend.model.CorrelationMatrix;
import com.hedgewise.backend.model.CurrencyExposure;
import com.hedgewise.backend.model.VolatilityProfile;
import com.hedgewise.backend.service.MetricsService;
import com.hedgewise.backend.util.CancellationToken;
import com.hedgewise.backend.util.RandomSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Simulates one-day portfolio returns in base currency. Trials are split into batches, each
 * with its own generator split off the seed before dispatch, so the sample only depends on the seed.
 * Draws are independent per currency unless correlated draws are enabled, in which case a
 * Cholesky factor of the correlation matrix is applied.
 */
@Slf4j
@Service
public class MonteCarloSimulator {

    private static final String OPERATION = "monte-carlo";

    private final RiskProperties riskProperties;
    private final RandomSource randomSource;
    private final Executor executor;
    private final MetricsService metricsService;

    public MonteCarloSimulator(RiskProperties riskProperties,
                               RandomSource randomSource,
                               @Qualifier("riskExecutor") Executor executor,
                               MetricsService metricsService) {
        this.riskProperties = riskProperties;
        this.randomSource = randomSource;
        this.executor = executor;
        this.metricsService = metricsService;
    }

    public Simulation simulate(List<CurrencyExposure> exposures,
                               Map<String, VolatilityProfile> volatilities,
                               CorrelationMatrix correlations,
                               CancellationToken token) {
        long started = System.nanoTime();
        RiskProperties.MonteCarlo config = riskProperties.getMonteCarlo();
        int trials = config.getTrials();
        int batchSize = Math.min(config.getBatchSize(), trials);
        int batches = (trials + batchSize - 1) / batchSize;

        int n = exposures.size();
        double[] scale = new double[n];
        List<String> currencies = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            CurrencyExposure exposure = exposures.get(i);
            currencies.add(exposure.currency());
            scale[i] = exposure.exposure() * volatilities.get(exposure.currency()).daily();
        }
        double[][] factor = config.isCorrelated() ? choleskyFactor(correlations, currencies) : null;

        double[] results = new double[trials];
        List<SplittableRandom> generators = randomSource.split(batches);
        List<CompletableFuture<Void>> futures = new ArrayList<>(batches);
        for (int b = 0; b < batches; b++) {
            int from = b * batchSize;
            int to = Math.min(trials, from + batchSize);
            SplittableRandom random = generators.get(b);
            futures.add(CompletableFuture.runAsync(() -> {
                token.throwIfCancelled(OPERATION);
                runBatch(random, scale, factor, results, from, to);
            }, executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        token.throwIfCancelled(OPERATION);

        Arrays.sort(results);
        double mean = Arrays.stream(results).average().orElse(0.0);
        double variance = 0.0;
        for (double value : results) {
            variance += (value - mean) * (value - mean);
        }
        double stdDev = Math.sqrt(variance / trials);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        metricsService.recordMonteCarlo(elapsed);
        log.debug("Monte Carlo: {} trials in {} batches, {} ms", trials, batches, elapsed.toMillis());
        return new Simulation(results, mean, stdDev, factor != null);
    }

    private static void runBatch(SplittableRandom random, double[] scale, double[][] factor,
                                 double[] results, int from, int to) {
        int n = scale.length;
        double[] draws = new double[n];
        for (int trial = from; trial < to; trial++) {
            for (int i = 0; i < n; i++) {
                draws[i] = random.nextGaussian();
            }
            double portfolioReturn = 0.0;
            for (int i = 0; i < n; i++) {
                double shock = draws[i];
                if (factor != null) {
                    shock = 0.0;
                    for (int k = 0; k <= i; k++) {
                        shock += factor[i][k] * draws[k];
                    }
                }
                portfolioReturn += scale[i] * shock;
            }
            results[trial] = portfolioReturn;
        }
    }

    private double[][] choleskyFactor(CorrelationMatrix correlations, List<String> currencies) {
        if (currencies.isEmpty()) {
            return null;
        }
        try {
            CholeskyDecomposition decomposition =
                    new CholeskyDecomposition(MatrixUtils.createRealMatrix(correlations.toArray(currencies)));
            return decomposition.getL().getData();
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            log.warn("Correlation matrix cannot be factored ({}), using independent draws", e.getMessage());
            return null;
        }
    }

    /**
     * Sorted simulated returns, most negative first.
     */
    public record Simulation(double[] sortedReturns, double mean, double stdDev, boolean correlated) {

        public int trials() {
            return sortedReturns.length;
        }
    }
}
