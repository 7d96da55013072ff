package com.hedgewise.backend.dto;

import com.hedgewise.backend.model.Account;
import com.hedgewise.backend.model.Portfolio;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioRequest {

    @NotBlank
    @Pattern(regexp = "[A-Z]{3}", message = "must be an ISO 4217 code")
    private String baseCurrency;

    @NotNull
    @Valid
    @Builder.Default
    private List<@NotNull @Valid AccountRequest> accounts = new ArrayList<>();

    public Portfolio toPortfolio() {
        List<Account> converted = accounts.stream()
                .map(account -> new Account(account.getCurrency(), account.getBalance(), account.getAccountType()))
                .toList();
        return new Portfolio(baseCurrency, converted);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AccountRequest {

        @NotBlank
        @Pattern(regexp = "[A-Z]{3}", message = "must be an ISO 4217 code")
        private String currency;

        private double balance;

        private String accountType;
    }
}
