package com.hedgewise.backend.model;

/**
 * Foreign-currency position expressed in the portfolio's base currency.
 *
 * @param exposure         absolute value in base currency
 * @param originalAmount   summed balance in the foreign currency
 * @param relativeExposure share of total foreign exposure
 * @param portfolioShare   share of total portfolio value, base-currency balances included
 * @param rank             1 for the largest exposure
 */
public record CurrencyExposure(
        String currency,
        double exposure,
        double originalAmount,
        double exchangeRate,
        double relativeExposure,
        double portfolioShare,
        int rank
) {
}
