package com.hedgewise.backend.exception;

import lombok.Getter;

import java.time.Instant;

@Getter
public class CalculationFailureException extends HedgingException {

    private final String operation;
    private final String userId;
    private final Instant timestamp;

    public CalculationFailureException(String operation, String userId, String message) {
        this(operation, userId, message, null);
    }

    public CalculationFailureException(String operation, String userId, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.userId = userId;
        this.timestamp = Instant.now();
    }
}
