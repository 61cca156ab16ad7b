package com.eon.credit.controller.dto;

import com.eon.credit.auth.Capability;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public final class AdminDtos {

    private AdminDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GrantRequest {
        @NotBlank
        public String principal;
        @NotNull
        public Capability capability;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CancelRequest {
        @NotBlank
        public String reason;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MintRequest {
        @NotBlank
        public String account;
        @NotBlank
        public String asset;
        @NotNull @Positive
        public BigDecimal amount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmergencyWithdrawRequest {
        @NotBlank
        public String recipient;
        @NotNull @Positive
        public BigDecimal amount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResolveRequest {
        public boolean upheld;
    }
}
