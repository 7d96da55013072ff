package com.hedgewise.backend.exception;

public class AssessmentNotFoundException extends HedgingException {
    public AssessmentNotFoundException(String userId) {
        super("No risk assessment available for user " + userId);
    }
}
