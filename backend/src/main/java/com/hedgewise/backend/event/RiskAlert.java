package com.hedgewise.backend.event;

import com.hedgewise.backend.model.Priority;

import java.time.Instant;

public record RiskAlert(
        AlertType type,
        Priority severity,
        String userId,
        String message,
        double value,
        double threshold,
        Instant timestamp
) {

    public enum AlertType {
        VAR_THRESHOLD,
        CONCENTRATION
    }
}
