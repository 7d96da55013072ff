package com.hedgewise.backend.controller;

import com.hedgewise.backend.exception.InvalidRequestException;
import com.hedgewise.backend.model.HedgingRecommendation;
import com.hedgewise.backend.model.StrategyProfile;
import com.hedgewise.backend.service.hedging.HedgingStrategyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.Locale;

@Slf4j
@RestController
@RequestMapping("/api/hedging")
@RequiredArgsConstructor
@Tag(name = "Hedging")
public class HedgingController {

    private final HedgingStrategyService hedgingStrategyService;

    @PostMapping("/{userId}/recommendations")
    @Operation(summary = "Generate hedging strategies for the user's latest risk assessment")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = HedgingRecommendation.class)))
    public ResponseEntity<HedgingRecommendation> recommend(@PathVariable String userId,
                                                           @RequestParam(required = false) String profile) {
        StrategyProfile strategyProfile = parseProfile(profile);
        log.info("Hedging recommendation requested for user {} (profile {})", userId, strategyProfile);
        return ResponseEntity.ok(hedgingStrategyService.recommend(userId, strategyProfile));
    }

    private static StrategyProfile parseProfile(String profile) {
        if (profile == null || profile.isBlank()) {
            return null;
        }
        try {
            return StrategyProfile.valueOf(profile.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown profile '" + profile + "', expected one of "
                    + Arrays.toString(StrategyProfile.values()).toLowerCase(Locale.ROOT));
        }
    }
}
