package com.eon.credit.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public final class IdentityDtos {

    private IdentityDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProofRequest {
        @NotBlank
        public String commitmentHash;   // 0x-prefixed bytes32
        @Positive
        public long expiresAt;          // epoch seconds
        @NotBlank
        public String signature;        // 65-byte personal_sign signature of the trusted issuer
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StakeRequest {
        @NotNull @Positive
        public BigDecimal amount;
        @Positive
        public long lockSeconds;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FirstSeenRequest {
        @Positive
        public long firstSeen;          // epoch seconds
    }
}
