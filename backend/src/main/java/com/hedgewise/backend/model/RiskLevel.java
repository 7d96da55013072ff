package com.hedgewise.backend.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
