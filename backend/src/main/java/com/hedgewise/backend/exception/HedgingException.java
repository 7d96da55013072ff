package com.hedgewise.backend.exception;

public class HedgingException extends RuntimeException {
    public HedgingException(String message) {
        super(message);
    }

    public HedgingException(String message, Throwable cause) {
        super(message, cause);
    }
}
