package com.eon.credit.controller;

import com.eon.credit.attestation.AttestedScore;
import com.eon.credit.attestation.PendingAttestation;
import com.eon.credit.attestation.ScoreAttestationService;
import com.eon.credit.controller.dto.AttestationDtos.*;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.error.NotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

@RestController
@RequestMapping("/api/attestations/{subject}")
@RequiredArgsConstructor
public class AttestationController {

    private final ScoreAttestationService attestations;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public PendingAttestation attest(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable String subject,
                                     @Valid @RequestBody AttestRequest req) {
        return attestations.attestScore(caller, subject, req.score, req.tier, req.ltvPercent,
                req.rateMultiplierPercent, req.dataQuality, req.evidenceRoot);
    }

    @PostMapping(value = "/challenge", consumes = MediaType.APPLICATION_JSON_VALUE)
    public PendingAttestation challenge(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable String subject,
                                        @Valid @RequestBody ChallengeRequest req) {
        return attestations.challengeScore(caller, subject, req.reason, req.bond);
    }

    /** Permissionless once the challenge period has passed unchallenged. */
    @PostMapping("/finalize")
    public AttestedScore finalizeScore(@PathVariable String subject) {
        return attestations.finalizeScore(subject);
    }

    @GetMapping("/pending")
    public PendingAttestation pending(@PathVariable String subject) {
        return attestations.pending(subject)
                .orElseThrow(() -> new NotFoundException(CreditErrorCode.SUBJECT_NOT_FOUND, "No pending attestation for " + subject));
    }

    @GetMapping
    public AttestedScore finalized(@PathVariable String subject) {
        return attestations.finalizedScore(subject)
                .orElseThrow(() -> new NotFoundException(CreditErrorCode.SUBJECT_NOT_FOUND, "No attested score for " + subject));
    }

    @GetMapping("/valid")
    public ValidityResponse valid(@PathVariable String subject,
                                  @RequestParam(defaultValue = "2592000") long maxAgeSeconds) {
        ValidityResponse res = new ValidityResponse();
        res.subject = subject;
        res.maxAgeSeconds = maxAgeSeconds;
        res.valid = attestations.hasValidScore(subject, Duration.ofSeconds(maxAgeSeconds));
        return res;
    }
}
