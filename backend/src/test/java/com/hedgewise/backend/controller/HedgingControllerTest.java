package com.hedgewise.backend.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HedgingControllerTest {

    private static final String PORTFOLIO = """
            {
              "baseCurrency": "USD",
              "accounts": [
                {"currency": "EUR", "balance": 150000},
                {"currency": "JPY", "balance": 9000000},
                {"currency": "GBP", "balance": 40000}
              ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void recommendsStrategiesAfterAnAssessment() throws Exception {
        mockMvc.perform(post("/api/risk/hedge-user/assessments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PORTFOLIO))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/hedging/hedge-user/recommendations").param("profile", "Balanced"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("hedge-user"))
                .andExpect(jsonPath("$.profile").value("BALANCED"))
                .andExpect(jsonPath("$.needs").isNotEmpty())
                .andExpect(jsonPath("$.strategies[0].rank").value(1))
                .andExpect(jsonPath("$.implementationPlan.phases.length()").value(3));
    }

    @Test
    void rejectsUnknownProfile() throws Exception {
        mockMvc.perform(post("/api/hedging/hedge-user/recommendations").param("profile", "reckless"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void requiresAnAssessmentFirst() throws Exception {
        mockMvc.perform(post("/api/hedging/fresh-user/recommendations"))
                .andExpect(status().isNotFound());
    }
}
