package com.hedgewise.backend.model;

public enum Urgency {
    IMMEDIATE,
    SHORT_TERM,
    PLANNED;

    public static Urgency forPriority(Priority priority) {
        return switch (priority) {
            case HIGH -> IMMEDIATE;
            case MEDIUM -> SHORT_TERM;
            case LOW -> PLANNED;
        };
    }
}
