package com.eon.credit.controller;

import com.eon.credit.controller.dto.LendingDtos.AmountRequest;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.NotFoundException;
import com.eon.credit.fund.DefaultRecord;
import com.eon.credit.fund.FundStatistics;
import com.eon.credit.fund.LossAbsorptionFund;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Map;

@RestController
@RequestMapping("/api/fund")
@RequiredArgsConstructor
public class FundController {

    private final LossAbsorptionFund fund;

    @GetMapping
    public FundStatistics statistics() {
        return fund.statistics();
    }

    @PostMapping(value = "/deposit", consumes = MediaType.APPLICATION_JSON_VALUE)
    public FundStatistics deposit(@RequestHeader(CallerHeader.NAME) String caller,
                                  @Valid @RequestBody AmountRequest req) {
        return fund.deposit(caller, req.amount);
    }

    /** What the fund would pay today for a default on a loan of {@code principal}. */
    @GetMapping("/coverage")
    public Map<String, Object> coverage(@RequestParam BigDecimal principal) {
        return Map.of(
                "principal", principal,
                "maxCoverage", fund.maxCoverage(principal),
                "availableCoverage", fund.availableCoverage(principal));
    }

    @GetMapping("/defaults/{loanId}")
    public DefaultRecord defaultRecord(@PathVariable long loanId) {
        return fund.defaultHistory(loanId)
                .orElseThrow(() -> new NotFoundException(CreditErrorCode.LOAN_NOT_FOUND, "No default recorded for loan " + loanId));
    }
}
