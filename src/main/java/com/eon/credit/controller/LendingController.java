package com.eon.credit.controller;

import com.eon.credit.controller.dto.LendingDtos.*;
import com.eon.credit.health.HealthMonitor;
import com.eon.credit.health.HealthStatus;
import com.eon.credit.lending.LendingService;
import com.eon.credit.lending.LoanPosition;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/loans")
@RequiredArgsConstructor
public class LendingController {

    private final LendingService lending;
    private final HealthMonitor healthMonitor;

    /** Opens a loan for the caller. Collateral and principal move through pre-approved allowances. */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public LoanPosition borrow(@RequestHeader(CallerHeader.NAME) String caller,
                               @Valid @RequestBody BorrowRequest req) {
        return lending.borrow(caller, req.collateralAsset, req.collateralAmount, req.principal);
    }

    @PostMapping(value = "/{loanId}/repay", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LendingService.Repayment repay(@RequestHeader(CallerHeader.NAME) String caller,
                                          @PathVariable long loanId,
                                          @Valid @RequestBody AmountRequest req) {
        return lending.repay(caller, loanId, req.amount);
    }

    @PostMapping(value = "/{loanId}/collateral", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LoanPosition addCollateral(@RequestHeader(CallerHeader.NAME) String caller,
                                      @PathVariable long loanId,
                                      @Valid @RequestBody AmountRequest req) {
        return lending.addCollateral(caller, loanId, req.amount);
    }

    @GetMapping
    public List<LoanPosition> bySubject(@RequestParam String subject) {
        return lending.positionsOf(subject);
    }

    @GetMapping("/{loanId}")
    public LoanPosition position(@PathVariable long loanId) {
        return lending.position(loanId);
    }

    @GetMapping("/{loanId}/debt")
    public DebtResponse debt(@PathVariable long loanId) {
        DebtResponse res = new DebtResponse();
        res.loanId = loanId;
        res.debt = lending.calculateDebt(loanId);
        return res;
    }

    @GetMapping("/{loanId}/health")
    public HealthStatus health(@PathVariable long loanId) {
        return lending.calculateHealthFactor(loanId);
    }

    /** Collateral (in asset units) to add so the position reaches {@code target}. */
    @GetMapping("/{loanId}/required-collateral")
    public RequiredCollateralResponse requiredCollateral(@PathVariable long loanId,
                                                         @RequestParam(defaultValue = "1.20") BigDecimal target) {
        RequiredCollateralResponse res = new RequiredCollateralResponse();
        res.loanId = loanId;
        res.targetHealthFactor = target;
        res.additionalCollateral = healthMonitor.requiredAdditionalCollateral(loanId, target);
        return res;
    }

    @GetMapping("/liquidatable")
    public List<HealthStatus> liquidatable() {
        return healthMonitor.liquidatablePositions();
    }
}
