package com.eon.credit.config;

import com.eon.credit.scoring.CreditTier;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Governance-tunable parameters. Everything the scoring and lending math depends on lives here
 * so that a parameter change is a configuration change carrying a new {@link Scoring#getVersion()}.
 */
@Data
@ConfigurationProperties(prefix = "credit")
public class CreditProperties {

    private Principals principals = new Principals();
    private Scoring scoring = new Scoring();
    private List<Tier> tiers = defaultTiers();
    private Rates rates = new Rates();
    private Health health = new Health();
    private Auction auction = new Auction();
    private Fund fund = new Fund();
    private Identity identity = new Identity();
    private Attestation attestation = new Attestation();
    private Pool pool = new Pool();
    private PriceFeed priceFeed = new PriceFeed();

    @Data
    public static class Principals {
        private String lendingEngine = "lending-engine";
        private String auctioneer = "liquidation-auctioneer";
        private List<String> admins = new ArrayList<>(List.of("governance"));
        private List<String> ledgerWriters = new ArrayList<>();
        private List<String> activityReporters = new ArrayList<>();
        private List<String> attesters = new ArrayList<>();
    }

    @Data
    public static class Scoring {
        private String version = "v3";
        private Weights weights = new Weights();
        private int minScore = 300;
        private int maxScore = 850;

        private int repaymentNeutral = 50;
        private int liquidationPenalty = 20;

        private int collateralNeutral = 50;
        private List<Band> collateralRatioBands = new ArrayList<>(List.of(
                new Band(new BigDecimal("2.0"), 100),
                new Band(new BigDecimal("1.5"), 85),
                new Band(new BigDecimal("1.25"), 70),
                new Band(new BigDecimal("1.1"), 50)));
        private int collateralRatioFloor = 30;
        private int maxLtvPenalty = 40;
        private int diversityBonusPerAsset = 5;
        private int maxDiversityBonus = 15;

        private Sybil sybil = new Sybil();

        private int votePoints = 5;
        private int proposalPoints = 15;
    }

    @Data
    public static class Weights {
        private int repayment = 40;
        private int collateral = 20;
        private int sybil = 20;
        private int reputation = 10;
        private int participation = 10;

        public int sum() {
            return repayment + collateral + sybil + reputation + participation;
        }
    }

    @Data
    public static class Sybil {
        private int proofBonus = 150;
        private int missingProofPenalty = -150;
        private int reducedMissingProofPenalty = -75;
        private int reductionMinAgeDays = 365;
        private BigDecimal reductionMinStake = new BigDecimal("10000");
        private List<Band> walletAgeBands = new ArrayList<>(List.of(
                new Band(new BigDecimal("365"), 0),
                new Band(new BigDecimal("180"), -50),
                new Band(new BigDecimal("90"), -100),
                new Band(new BigDecimal("30"), -200)));
        private int youngWalletPenalty = -300;
        private List<Band> stakeBands = new ArrayList<>(List.of(
                new Band(new BigDecimal("10000"), 50),
                new Band(new BigDecimal("5000"), 40),
                new Band(new BigDecimal("1000"), 30),
                new Band(new BigDecimal("100"), 25)));
        private int activityThreshold = 10;
        private int activityBonus = 10;
        private int rawFloor = -450;
        private int rawCeiling = 210;
    }

    /** Threshold/points pair; bands are matched first-hit in descending threshold order. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Band {
        private BigDecimal threshold;
        private int points;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Tier {
        private CreditTier name;
        private int minScore;
        private BigDecimal maxLtv;
        private BigDecimal rateMultiplier;
        private Duration gracePeriod;
    }

    @Data
    public static class Rates {
        private BigDecimal baseRate = new BigDecimal("0.02");
        private BigDecimal optimalUtilization = new BigDecimal("0.80");
        private BigDecimal slope1 = new BigDecimal("0.04");
        private BigDecimal slope2 = new BigDecimal("0.60");
        private BigDecimal protocolFee = new BigDecimal("0.10");
    }

    @Data
    public static class Health {
        private BigDecimal liquidationTrigger = new BigDecimal("0.95");
        private BigDecimal safeThreshold = new BigDecimal("1.20");
        private BigDecimal warningThreshold = new BigDecimal("1.05");
        private BigDecimal maxLeverageTolerance = new BigDecimal("0.01");
    }

    @Data
    public static class Auction {
        private Duration duration = Duration.ofHours(6);
        private BigDecimal maxDiscount = new BigDecimal("0.20");
    }

    @Data
    public static class Fund {
        private BigDecimal maxCoveragePercent = new BigDecimal("0.0025");
        private BigDecimal revenueAllocationPercent = new BigDecimal("0.05");
    }

    @Data
    public static class Identity {
        private String trustedIssuer = "0x0000000000000000000000000000000000000000";
        private String stakingAsset = "USDC";
    }

    @Data
    public static class Attestation {
        private Duration challengePeriod = Duration.ofHours(1);
        private BigDecimal challengeBond = new BigDecimal("500");
        private String bondAsset = "USDC";
    }

    @Data
    public static class Pool {
        private String borrowAsset = "USDC";
        private List<String> collateralAssets = new ArrayList<>(List.of("WETH", "WBTC"));
    }

    @Data
    public static class PriceFeed {
        private String mode = "static";
        private Duration maxStaleness = Duration.ofHours(1);
        private Map<String, BigDecimal> staticPrices = new HashMap<>();
        private Map<String, String> aggregators = new HashMap<>();
    }

    static List<Tier> defaultTiers() {
        return new ArrayList<>(List.of(
                new Tier(CreditTier.BRONZE, 0, new BigDecimal("0.50"), new BigDecimal("1.5"), Duration.ofHours(24)),
                new Tier(CreditTier.SILVER, 600, new BigDecimal("0.65"), new BigDecimal("1.2"), Duration.ofHours(36)),
                new Tier(CreditTier.GOLD, 740, new BigDecimal("0.75"), new BigDecimal("1.0"), Duration.ofHours(48)),
                new Tier(CreditTier.PLATINUM, 800, new BigDecimal("0.90"), new BigDecimal("0.8"), Duration.ofHours(72))));
    }
}
