package com.eon.credit.controller;

import com.eon.credit.attestation.AttestedScore;
import com.eon.credit.attestation.ScoreAttestationService;
import com.eon.credit.auth.AllowListRepository;
import com.eon.credit.auth.AuthorizationGate;
import com.eon.credit.auth.Capability;
import com.eon.credit.controller.dto.AdminDtos.*;
import com.eon.credit.controller.dto.AuctionView;
import com.eon.credit.fund.LossAbsorptionFund;
import com.eon.credit.liquidation.Auction;
import com.eon.credit.liquidation.LiquidationAuctioneer;
import com.eon.credit.transfer.TokenVault;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Governance operations. Every endpoint requires the caller to hold {@link Capability#ADMIN}. */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AuthorizationGate gate;
    private final LiquidationAuctioneer auctioneer;
    private final LossAbsorptionFund fund;
    private final ScoreAttestationService attestations;
    private final TokenVault vault;

    @GetMapping("/grants")
    public List<AllowListRepository.Grant> grants(@RequestHeader(CallerHeader.NAME) String caller) {
        gate.require(caller, Capability.ADMIN);
        return gate.grants();
    }

    @PostMapping(value = "/grants", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> grant(@RequestHeader(CallerHeader.NAME) String caller,
                                     @Valid @RequestBody GrantRequest req) {
        gate.grant(caller, req.principal, req.capability);
        return Map.of("principal", req.principal, "capability", req.capability, "authorized", true);
    }

    @DeleteMapping("/grants/{principal}/{capability}")
    public Map<String, Object> revoke(@RequestHeader(CallerHeader.NAME) String caller,
                                      @PathVariable String principal, @PathVariable Capability capability) {
        gate.revoke(caller, principal, capability);
        return Map.of("principal", principal, "capability", capability, "authorized", false);
    }

    @PostMapping(value = "/auctions/{auctionId}/cancel", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AuctionView cancel(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable long auctionId,
                              @Valid @RequestBody CancelRequest req) {
        Auction a = auctioneer.cancelAuction(caller, auctionId, req.reason);
        return AuctionView.of(a, auctioneer.phase(auctionId), BigDecimal.ZERO, 0);
    }

    @PostMapping(value = "/fund/withdraw", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> emergencyWithdraw(@RequestHeader(CallerHeader.NAME) String caller,
                                                 @Valid @RequestBody EmergencyWithdrawRequest req) {
        BigDecimal remaining = fund.emergencyWithdraw(caller, req.recipient, req.amount);
        return Map.of("recipient", req.recipient, "amount", req.amount, "fundBalance", remaining);
    }

    @PostMapping(value = "/attestations/{subject}/resolve", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> resolve(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable String subject,
                                       @RequestBody ResolveRequest req) {
        Optional<AttestedScore> finalized = attestations.resolveChallenge(caller, subject, req.upheld);
        Map<String, Object> out = new HashMap<>();
        out.put("subject", subject);
        out.put("upheld", req.upheld);
        out.put("finalized", finalized.orElse(null));
        return out;
    }

    /** Credits test balances on the internal token book. */
    @PostMapping(value = "/mint", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> mint(@RequestHeader(CallerHeader.NAME) String caller,
                                    @Valid @RequestBody MintRequest req) {
        gate.require(caller, Capability.ADMIN);
        vault.mint(req.account, req.asset, req.amount);
        log.info("{} minted {} {} to {}", caller, req.amount, req.asset, req.account);
        return Map.of("account", req.account, "asset", req.asset, "balance", vault.balanceOf(req.account, req.asset));
    }
}
