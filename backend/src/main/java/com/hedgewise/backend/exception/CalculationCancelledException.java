package com.hedgewise.backend.exception;

import lombok.Getter;

@Getter
public class CalculationCancelledException extends HedgingException {

    private final String operation;

    public CalculationCancelledException(String operation) {
        super(operation + " was cancelled by a newer request");
        this.operation = operation;
    }
}
