package com.hedgewise.backend.service.risk;

@FunctionalInterface
public interface ExchangeRateLookup {

    double rate(String from, String to);
}
