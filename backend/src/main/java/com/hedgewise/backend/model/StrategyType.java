package com.hedgewise.backend.model;

public enum StrategyType {
    SINGLE,
    COMBINATION,
    BASKET,
    NATURAL
}
