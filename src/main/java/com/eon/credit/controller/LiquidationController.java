package com.eon.credit.controller;

import com.eon.credit.controller.dto.AuctionView;
import com.eon.credit.liquidation.Auction;
import com.eon.credit.liquidation.LiquidationAuctioneer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/liquidations")
@RequiredArgsConstructor
public class LiquidationController {

    private final LiquidationAuctioneer auctioneer;

    /** Anyone may start the grace window for an unhealthy loan. */
    @PostMapping("/loans/{loanId}")
    public AuctionView start(@PathVariable long loanId) {
        return view(auctioneer.startLiquidation(loanId));
    }

    @PostMapping("/{auctionId}/execute")
    public AuctionView execute(@RequestHeader(CallerHeader.NAME) String caller, @PathVariable long auctionId) {
        return view(auctioneer.executeLiquidation(caller, auctionId));
    }

    @GetMapping("/{auctionId}")
    public AuctionView get(@PathVariable long auctionId) {
        return view(auctioneer.auction(auctionId));
    }

    @GetMapping("/loans/{loanId}")
    public List<AuctionView> forLoan(@PathVariable long loanId) {
        return auctioneer.auctionsForLoan(loanId).stream().map(this::view).collect(Collectors.toList());
    }

    @GetMapping
    public List<AuctionView> open() {
        return auctioneer.openAuctions().stream().map(this::view).collect(Collectors.toList());
    }

    private AuctionView view(Auction a) {
        return AuctionView.of(a, auctioneer.phase(a.id()), auctioneer.currentDiscount(a.id()),
                auctioneer.gracePeriodRemaining(a.id()).getSeconds());
    }
}
