package com.eon.credit.controller;

import com.eon.credit.controller.dto.LendingDtos.AprResponse;
import com.eon.credit.lending.LendingService;
import com.eon.credit.lending.LiquidityPool;
import com.eon.credit.scoring.ScoreBreakdown;
import com.eon.credit.scoring.ScoreEngine;
import com.eon.credit.scoring.TierTable;
import com.eon.credit.scoring.TierTerms;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ScoreController {

    private final ScoreEngine scoreEngine;
    private final TierTable tiers;
    private final LendingService lending;
    private final LiquidityPool pool;

    /** Full breakdown: overall, credit score, tier and the five factors. */
    @GetMapping("/scores/{subject}")
    public ScoreBreakdown score(@PathVariable String subject) {
        return scoreEngine.computeScore(subject);
    }

    @GetMapping("/scores/{subject}/tier")
    public TierTerms tier(@PathVariable String subject) {
        return scoreEngine.getScoreTier(subject);
    }

    @GetMapping("/scores/{subject}/apr")
    public AprResponse apr(@PathVariable String subject) {
        AprResponse res = new AprResponse();
        res.subject = subject;
        res.apr = lending.aprFor(subject);
        res.utilization = pool.utilization();
        return res;
    }

    @GetMapping("/tiers")
    public List<TierTerms> tiers() {
        return tiers.all();
    }
}
