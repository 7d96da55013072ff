package com.hedgewise.backend.model;

public enum Priority {
    HIGH,
    MEDIUM,
    LOW
}
