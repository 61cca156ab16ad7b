package com.eon.credit.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public final class AttestationDtos {

    private AttestationDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AttestRequest {
        public int score;
        public int tier;                    // 0 = BRONZE .. 3 = PLATINUM
        public int ltvPercent;
        public int rateMultiplierPercent;
        public int dataQuality;             // 0 low, 1 medium, 2 high
        @NotBlank
        public String evidenceRoot;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChallengeRequest {
        @NotBlank
        public String reason;
        @NotNull
        public BigDecimal bond;
    }

    public static class ValidityResponse {
        public String subject;
        public boolean valid;
        public long maxAgeSeconds;
    }
}
