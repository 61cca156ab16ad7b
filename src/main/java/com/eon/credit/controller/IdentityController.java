package com.eon.credit.controller;

import com.eon.credit.controller.dto.IdentityDtos.*;
import com.eon.credit.controller.dto.LendingDtos.AmountRequest;
import com.eon.credit.identity.ActivityCounters;
import com.eon.credit.identity.IdentityProof;
import com.eon.credit.identity.IdentityService;
import com.eon.credit.identity.StakeCommitment;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/identity")
@RequiredArgsConstructor
public class IdentityController {

    private final IdentityService identity;

    /** Caller submits an issuer-signed uniqueness commitment for itself. */
    @PostMapping(value = "/proof", consumes = MediaType.APPLICATION_JSON_VALUE)
    public IdentityProof submitProof(@RequestHeader(CallerHeader.NAME) String caller,
                                     @Valid @RequestBody ProofRequest req) {
        return identity.submitIdentityProof(caller, req.commitmentHash, req.expiresAt, req.signature);
    }

    @PostMapping(value = "/stake", consumes = MediaType.APPLICATION_JSON_VALUE)
    public StakeCommitment stake(@RequestHeader(CallerHeader.NAME) String caller,
                                 @Valid @RequestBody StakeRequest req) {
        return identity.stake(caller, req.amount, Duration.ofSeconds(req.lockSeconds));
    }

    @PostMapping(value = "/unstake", consumes = MediaType.APPLICATION_JSON_VALUE)
    public StakeCommitment unstake(@RequestHeader(CallerHeader.NAME) String caller,
                                   @Valid @RequestBody AmountRequest req) {
        return identity.unstake(caller, req.amount);
    }

    @GetMapping("/{subject}")
    public Map<String, Object> summary(@PathVariable String subject) {
        Map<String, Object> out = new HashMap<>();
        out.put("subject", subject);
        out.put("proof", identity.proofOf(subject).orElse(null));
        out.put("stake", identity.stakeOf(subject));
        out.put("activity", identity.activityOf(subject));
        return out;
    }

    // -------- activity reporters ----------
    @PostMapping("/{subject}/votes")
    public ActivityCounters vote(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable String subject) {
        return identity.recordVote(caller, subject);
    }

    @PostMapping("/{subject}/proposals")
    public ActivityCounters proposal(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable String subject) {
        return identity.recordProposal(caller, subject);
    }

    @PostMapping(value = "/{subject}/first-seen", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ActivityCounters firstSeen(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable String subject,
                                      @Valid @RequestBody FirstSeenRequest req) {
        return identity.recordFirstSeen(caller, subject, Instant.ofEpochSecond(req.firstSeen));
    }
}
