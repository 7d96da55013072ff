package com.hedgewise.backend.model;

public record Account(String currency, double balance, String accountType) {
}
