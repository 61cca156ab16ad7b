package com.eon.credit.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public final class RegistryDtos {

    private RegistryDtos() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegisterLoanRequest {
        @NotBlank
        public String subject;
        @NotNull @Positive
        public BigDecimal principal;
        public String counterparty;     // defaults to the caller
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RepaymentRequest {
        @NotNull @Positive
        public BigDecimal amount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LiquidationRequest {
        @NotNull @PositiveOrZero
        public BigDecimal recoveredAmount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CollateralRequest {
        @NotBlank
        public String collateralAsset;
        @NotNull @Positive
        public BigDecimal collateralValueUsd;
        public int scoreAtOrigination;
    }

    public static class LoanCreated {
        public long loanId;
    }
}
