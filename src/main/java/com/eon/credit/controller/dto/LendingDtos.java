package com.eon.credit.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public final class LendingDtos {

    private LendingDtos() {}

    // -------- Requests ----------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BorrowRequest {
        @NotBlank
        public String collateralAsset;
        @NotNull @Positive
        public BigDecimal collateralAmount;
        @NotNull @Positive
        public BigDecimal principal;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AmountRequest {
        @NotNull @Positive
        public BigDecimal amount;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WithdrawRequest {
        @NotNull @Positive
        public BigDecimal shares;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApproveRequest {
        @NotBlank
        public String asset;
        @NotNull
        public BigDecimal amount;
        public String spender;   // defaults to the protocol account
    }

    // -------- Responses ----------
    public static class DebtResponse {
        public long loanId;
        public BigDecimal debt;
    }

    public static class AprResponse {
        public String subject;
        public BigDecimal apr;
        public BigDecimal utilization;
    }

    public static class RequiredCollateralResponse {
        public long loanId;
        public BigDecimal targetHealthFactor;
        public BigDecimal additionalCollateral;
    }

    public static class BalanceResponse {
        public String account;
        public String asset;
        public BigDecimal balance;
    }
}
