package com.eon.credit.controller;

import com.eon.credit.controller.dto.RegistryDtos.*;
import com.eon.credit.ledger.AggregateCounters;
import com.eon.credit.ledger.CollateralRecord;
import com.eon.credit.ledger.CreditRegistry;
import com.eon.credit.ledger.LoanRecord;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Ledger writes for allow-listed reporters, plus the raw ledger reads. */
@RestController
@RequestMapping("/api/registry")
@RequiredArgsConstructor
public class RegistryController {

    private final CreditRegistry registry;

    @PostMapping(value = "/loans", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public LoanCreated registerLoan(@RequestHeader(CallerHeader.NAME) String caller,
                                    @Valid @RequestBody RegisterLoanRequest req) {
        LoanCreated res = new LoanCreated();
        res.loanId = registry.registerLoan(caller, req.subject, req.principal, req.counterparty);
        return res;
    }

    @PostMapping(value = "/loans/{loanId}/repayments", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LoanRecord registerRepayment(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable long loanId,
                                        @Valid @RequestBody RepaymentRequest req) {
        return registry.registerRepayment(caller, loanId, req.amount);
    }

    @PostMapping(value = "/loans/{loanId}/liquidation", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LoanRecord registerLiquidation(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable long loanId,
                                          @Valid @RequestBody LiquidationRequest req) {
        return registry.registerLiquidation(caller, loanId, req.recoveredAmount);
    }

    @PostMapping(value = "/loans/{loanId}/collateral", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CollateralRecord recordCollateral(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable long loanId,
                                             @Valid @RequestBody CollateralRequest req) {
        return registry.recordCollateral(caller, loanId, req.collateralAsset, req.collateralValueUsd,
                req.scoreAtOrigination);
    }

    @GetMapping("/loans/{loanId}")
    public LoanRecord loan(@PathVariable long loanId) {
        return registry.getLoan(loanId);
    }

    @GetMapping("/subjects/{subject}/loans")
    public List<LoanRecord> loans(@PathVariable String subject) {
        return registry.loansOf(subject);
    }

    @GetMapping("/subjects/{subject}/counters")
    public AggregateCounters counters(@PathVariable String subject) {
        return registry.counters(subject);
    }
}
