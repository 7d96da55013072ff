package com.hedgewise.backend.model;

import java.util.List;

public record Portfolio(String baseCurrency, List<Account> accounts) {

    public Portfolio {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }
}
