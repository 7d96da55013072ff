package com.hedgewise.backend.exception;

public class InvalidRequestException extends HedgingException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
