package com.hedgewise.backend.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable symmetric matrix of pairwise currency correlations with a unit diagonal.
 * Currencies without usable return data are tracked so callers can distinguish
 * "uncorrelated" from "unknown".
 */
public final class CorrelationMatrix {

    private final List<String> currencies;
    private final Map<String, Integer> index;
    private final double[][] values;
    private final boolean[] available;

    private CorrelationMatrix(List<String> currencies, double[][] values, boolean[] available) {
        this.currencies = List.copyOf(currencies);
        this.values = values;
        this.available = available;
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < currencies.size(); i++) {
            positions.put(currencies.get(i), i);
        }
        this.index = Collections.unmodifiableMap(positions);
    }

    public static CorrelationMatrix empty() {
        return new CorrelationMatrix(List.of(), new double[0][0], new boolean[0]);
    }

    public static Builder builder(List<String> currencies) {
        return new Builder(currencies);
    }

    public List<String> getCurrencies() {
        return currencies;
    }

    /**
     * Correlation keyed "A/B" for every unordered pair with data on both sides.
     */
    public Map<String, Double> getPairs() {
        Map<String, Double> pairs = new LinkedHashMap<>();
        for (int i = 0; i < currencies.size(); i++) {
            for (int j = i + 1; j < currencies.size(); j++) {
                if (available[i] && available[j]) {
                    pairs.put(currencies.get(i) + "/" + currencies.get(j), values[i][j]);
                }
            }
        }
        return pairs;
    }

    public List<String> getUnavailableCurrencies() {
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < currencies.size(); i++) {
            if (!available[i]) {
                missing.add(currencies.get(i));
            }
        }
        return missing;
    }

    public boolean hasData(String currency) {
        Integer position = index.get(currency);
        return position != null && available[position];
    }

    public boolean hasData(String first, String second) {
        return hasData(first) && hasData(second);
    }

    /**
     * Returns 1 for identical currencies and 0 when either side has no data.
     */
    public double correlation(String first, String second) {
        if (first.equals(second)) {
            return 1.0;
        }
        Integer i = index.get(first);
        Integer j = index.get(second);
        if (i == null || j == null || !available[i] || !available[j]) {
            return 0.0;
        }
        return values[i][j];
    }

    public double[][] toArray(List<String> order) {
        int n = order.size();
        double[][] result = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result[i][j] = correlation(order.get(i), order.get(j));
            }
        }
        return result;
    }

    public static final class Builder {
        private final List<String> currencies;
        private final Map<String, Integer> index = new HashMap<>();
        private final double[][] values;
        private final boolean[] available;

        private Builder(List<String> currencies) {
            this.currencies = List.copyOf(currencies);
            int n = currencies.size();
            this.values = new double[n][n];
            this.available = new boolean[n];
            for (int i = 0; i < n; i++) {
                index.put(currencies.get(i), i);
                values[i][i] = 1.0;
            }
        }

        public Builder available(String currency) {
            available[position(currency)] = true;
            return this;
        }

        public Builder correlation(String first, String second, double value) {
            int i = position(first);
            int j = position(second);
            if (i == j) {
                return this;
            }
            double bounded = Math.max(-1.0, Math.min(1.0, value));
            values[i][j] = bounded;
            values[j][i] = bounded;
            return this;
        }

        public CorrelationMatrix build() {
            double[][] copy = new double[values.length][];
            for (int i = 0; i < values.length; i++) {
                copy[i] = values[i].clone();
            }
            return new CorrelationMatrix(currencies, copy, available.clone());
        }

        private int position(String currency) {
            Integer position = index.get(currency);
            if (position == null) {
                throw new IllegalArgumentException("Unknown currency " + currency);
            }
            return position;
        }
    }
}
