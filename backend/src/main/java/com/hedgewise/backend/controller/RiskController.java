package com.hedgewise.backend.controller;

import com.hedgewise.backend.dto.PortfolioRequest;
import com.hedgewise.backend.model.RiskAssessment;
import com.hedgewise.backend.service.risk.CurrencyRiskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
@Tag(name = "Risk")
public class RiskController {

    private final CurrencyRiskService currencyRiskService;

    @PostMapping("/{userId}/assessments")
    @Operation(summary = "Calculate a currency risk assessment for a portfolio")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = RiskAssessment.class)))
    public ResponseEntity<RiskAssessment> calculate(@PathVariable String userId,
                                                    @Valid @RequestBody PortfolioRequest request) {
        log.info("Risk assessment requested for user {} ({} accounts)", userId, request.getAccounts().size());
        return ResponseEntity.ok(currencyRiskService.calculateRisk(userId, request.toPortfolio()));
    }

    @GetMapping("/{userId}/assessments/latest")
    @Operation(summary = "Get the most recent risk assessment for a user")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = RiskAssessment.class)))
    public ResponseEntity<RiskAssessment> latest(@PathVariable String userId) {
        return ResponseEntity.ok(currencyRiskService.requireLatestAssessment(userId));
    }
}
