package com.hedgewise.backend.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    SEVERE;

    public static Severity forLossFraction(double fraction) {
        if (fraction > 0.20) {
            return SEVERE;
        }
        if (fraction > 0.10) {
            return HIGH;
        }
        if (fraction > 0.05) {
            return MEDIUM;
        }
        return LOW;
    }
}
