package com.eon.credit.controller;

import com.eon.credit.controller.dto.LendingDtos.ApproveRequest;
import com.eon.credit.controller.dto.LendingDtos.BalanceResponse;
import com.eon.credit.transfer.SystemAccounts;
import com.eon.credit.transfer.TransferGateway;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Map;

@RestController
@RequestMapping("/api/tokens")
@RequiredArgsConstructor
public class TokenController {

    private final TransferGateway transfers;

    /** Caller authorizes the protocol (or another spender) to pull up to {@code amount}. */
    @PostMapping(value = "/approve", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> approve(@RequestHeader(CallerHeader.NAME) String caller,
                                       @Valid @RequestBody ApproveRequest req) {
        String spender = StringUtils.hasText(req.spender) ? req.spender : SystemAccounts.PROTOCOL;
        transfers.approve(caller, spender, req.asset, req.amount);
        BigDecimal allowance = transfers.allowance(caller, spender, req.asset);
        return Map.of("owner", caller, "spender", spender, "asset", req.asset, "allowance", allowance);
    }

    @GetMapping("/{asset}/balances/{account}")
    public BalanceResponse balance(@PathVariable String asset, @PathVariable String account) {
        BalanceResponse res = new BalanceResponse();
        res.account = account;
        res.asset = asset;
        res.balance = transfers.balanceOf(account, asset);
        return res;
    }
}
