package com.hedgewise.backend.service.marketdata;

import com.hedgewise.backend.config.MarketDataProperties;
import com.hedgewise.backend.exception.DataUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Guards calls to the {@link MarketDataProvider} with a circuit breaker and a timeout.
 * Failures are not retried; every failure surfaces as {@link DataUnavailableException}.
 */
@Slf4j
@Service
public class MarketDataClient {

    private final MarketDataProvider provider;
    private final CircuitBreaker circuitBreaker;
    private final Executor executor;
    private final long timeoutMs;

    public MarketDataClient(MarketDataProvider provider,
                            @Qualifier("marketDataCircuitBreaker") CircuitBreaker circuitBreaker,
                            @Qualifier("riskExecutor") Executor executor,
                            MarketDataProperties properties) {
        this.provider = provider;
        this.circuitBreaker = circuitBreaker;
        this.executor = executor;
        this.timeoutMs = properties.getTimeoutMs();
    }

    public double getExchangeRate(String from, String to) {
        if (from.equals(to)) {
            return 1.0;
        }
        CompletableFuture<Double> future = submit(() -> provider.getExchangeRate(from, to));
        Double rate = await(future, from, "exchange-rate");
        if (rate == null || !Double.isFinite(rate) || rate <= 0.0) {
            throw new DataUnavailableException(from, "exchange-rate",
                    "Provider returned an unusable rate for " + from + "/" + to + ": " + rate);
        }
        return rate;
    }

    /**
     * Completes exceptionally with {@link DataUnavailableException} on failure or timeout.
     */
    public CompletableFuture<List<Double>> fetchHistoricalPrices(String currency, String base, int days) {
        return submit(() -> provider.getHistoricalPrices(currency, base, days))
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((prices, error) -> {
                    if (error != null) {
                        throw translate(currency, "historical-prices", unwrap(error));
                    }
                    if (prices == null || prices.isEmpty()) {
                        throw new DataUnavailableException(currency, "historical-prices",
                                "No price history for " + currency + "/" + base);
                    }
                    return prices;
                });
    }

    private <T> CompletableFuture<T> submit(Supplier<T> call) {
        return CompletableFuture.supplyAsync(circuitBreaker.decorateSupplier(call), executor);
    }

    private <T> T await(CompletableFuture<T> future, String currency, String operation) {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw translate(currency, operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw translate(currency, operation, e);
        } catch (ExecutionException e) {
            throw translate(currency, operation, e.getCause());
        }
    }

    private DataUnavailableException translate(String currency, String operation, Throwable error) {
        if (error instanceof DataUnavailableException unavailable) {
            return unavailable;
        }
        String reason;
        if (error instanceof CallNotPermittedException) {
            reason = "market data circuit open";
        } else if (error instanceof TimeoutException) {
            reason = "timed out after " + timeoutMs + " ms";
        } else {
            reason = error.getMessage();
        }
        log.debug("Market data {} failed for {}: {}", operation, currency, reason);
        return new DataUnavailableException(currency, operation,
                "Market data " + operation + " unavailable for " + currency + ": " + reason, error);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
