package com.hedgewise.backend.model;

public record ExpectedShortfall(double confidenceLevel, double value, String interpretation) {
}
