package com.hedgewise.backend.exception;

import lombok.Getter;

/**
 * Raised when an exchange rate or price history cannot be obtained for a currency.
 */
@Getter
public class DataUnavailableException extends HedgingException {

    private final String currency;
    private final String operation;

    public DataUnavailableException(String currency, String operation, String message) {
        super(message);
        this.currency = currency;
        this.operation = operation;
    }

    public DataUnavailableException(String currency, String operation, String message, Throwable cause) {
        super(message, cause);
        this.currency = currency;
        this.operation = operation;
    }
}
