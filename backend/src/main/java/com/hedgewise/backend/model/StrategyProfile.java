package com.hedgewise.backend.model;

public enum StrategyProfile {
    CONSERVATIVE,
    BALANCED,
    AGGRESSIVE,
    DYNAMIC
}
