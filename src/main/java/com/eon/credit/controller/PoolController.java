package com.eon.credit.controller;

import com.eon.credit.controller.dto.LendingDtos.AmountRequest;
import com.eon.credit.controller.dto.LendingDtos.WithdrawRequest;
import com.eon.credit.lending.LiquidityPool;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/pool")
@RequiredArgsConstructor
public class PoolController {

    private final LiquidityPool pool;

    @GetMapping
    public LiquidityPool.PoolStats stats() {
        return pool.stats();
    }

    @PostMapping(value = "/deposit", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LiquidityPool.LpPosition deposit(@RequestHeader(CallerHeader.NAME) String caller,
                                            @Valid @RequestBody AmountRequest req) {
        return pool.deposit(caller, req.amount);
    }

    @PostMapping(value = "/withdraw", consumes = MediaType.APPLICATION_JSON_VALUE)
    public LiquidityPool.LpPosition withdraw(@RequestHeader(CallerHeader.NAME) String caller,
                                             @Valid @RequestBody WithdrawRequest req) {
        return pool.withdraw(caller, req.shares);
    }

    @GetMapping("/positions/{provider}")
    public LiquidityPool.LpPosition position(@PathVariable String provider) {
        return pool.positionOf(provider);
    }
}
