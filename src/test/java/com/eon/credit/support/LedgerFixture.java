package com.eon.credit.support;

import com.eon.credit.attestation.AttestationRepository;
import com.eon.credit.attestation.ScoreAttestationService;
import com.eon.credit.auth.AllowListRepository;
import com.eon.credit.auth.AuthorizationGate;
import com.eon.credit.auth.Capability;
import com.eon.credit.config.CreditProperties;
import com.eon.credit.fund.FundRepository;
import com.eon.credit.fund.LossAbsorptionFund;
import com.eon.credit.health.HealthMonitor;
import com.eon.credit.identity.IdentityProof;
import com.eon.credit.identity.IdentityProofVerifier;
import com.eon.credit.identity.IdentityRepository;
import com.eon.credit.identity.IdentityService;
import com.eon.credit.identity.StakeCommitment;
import com.eon.credit.ledger.CreditRegistry;
import com.eon.credit.ledger.LedgerRepository;
import com.eon.credit.ledger.LedgerTransactions;
import com.eon.credit.lending.InterestRateModel;
import com.eon.credit.lending.LendingService;
import com.eon.credit.lending.LiquidityPool;
import com.eon.credit.lending.LoanPositionRepository;
import com.eon.credit.lending.PoolRepository;
import com.eon.credit.lending.PriceOracle;
import com.eon.credit.liquidation.AuctionRepository;
import com.eon.credit.liquidation.LiquidationAuctioneer;
import com.eon.credit.scoring.ScoreEngine;
import com.eon.credit.scoring.TierTable;
import com.eon.credit.transfer.SystemAccounts;
import com.eon.credit.transfer.TokenVault;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * The whole ledger wired by hand over a private in-memory H2 database, with a test clock, stub
 * prices and a settable external reputation per subject.
 */
public class LedgerFixture implements AutoCloseable {

    public static final Instant START = Instant.parse("2025-01-01T00:00:00Z");
    public static final String USDC = "USDC";
    public static final String WETH = "WETH";
    public static final String WBTC = "WBTC";

    public static final String ADMIN = "governance";
    public static final String WRITER = "bank-reporter";
    public static final String REPORTER = "governance-indexer";
    public static final String ATTESTER = "score-oracle";
    public static final String LP = "liquidity-provider";

    public final EmbeddedDatabase database;
    public final JdbcTemplate jdbc;
    public final MutableClock clock = new MutableClock(START);
    public final CreditProperties properties;
    public final StubPriceFeed priceFeed = new StubPriceFeed(clock);
    public final Map<String, Integer> reputation = new HashMap<>();

    public final LedgerTransactions transactions;
    public final AuthorizationGate gate;
    public final LedgerRepository ledger;
    public final IdentityRepository identityRepository;
    public final TierTable tiers;
    public final CreditRegistry registry;
    public final TokenVault vault;
    public final ScoreEngine scoreEngine;
    public final IdentityService identity;
    public final AttestationRepository attestationRepository;
    public final ScoreAttestationService attestations;
    public final InterestRateModel rateModel;
    public final LiquidityPool pool;
    public final PriceOracle oracle;
    public final LoanPositionRepository positions;
    public final HealthMonitor healthMonitor;
    public final LossAbsorptionFund fund;
    public final LendingService lending;
    public final LiquidationAuctioneer auctioneer;

    public LedgerFixture() {
        this(new CreditProperties());
    }

    public LedgerFixture(CreditProperties properties) {
        this.properties = properties;
        this.database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
        this.jdbc = new JdbcTemplate(database);
        this.transactions = new LedgerTransactions(new DataSourceTransactionManager(database));

        this.gate = new AuthorizationGate(new AllowListRepository(jdbc), transactions, clock);
        this.ledger = new LedgerRepository(jdbc);
        this.identityRepository = new IdentityRepository(jdbc);
        this.tiers = new TierTable(properties);
        this.registry = new CreditRegistry(ledger, identityRepository, gate, transactions, tiers, properties, clock);
        this.vault = new TokenVault(jdbc);
        this.scoreEngine = new ScoreEngine(ledger, identityRepository, s -> reputation.getOrDefault(s, 0),
                tiers, properties, clock);
        this.identity = new IdentityService(identityRepository, new IdentityProofVerifier(properties), vault, gate,
                transactions, properties, clock);
        this.attestationRepository = new AttestationRepository(jdbc);
        this.attestations = new ScoreAttestationService(attestationRepository, vault, gate, transactions, properties, clock);
        this.rateModel = new InterestRateModel(properties);
        this.pool = new LiquidityPool(new PoolRepository(jdbc), vault, rateModel, transactions, properties);
        this.oracle = new PriceOracle(priceFeed, properties, clock);
        this.positions = new LoanPositionRepository(jdbc);
        this.healthMonitor = new HealthMonitor(positions, oracle, properties, clock);
        this.fund = new LossAbsorptionFund(new FundRepository(jdbc), vault, gate, transactions, properties, clock);
        this.lending = new LendingService(positions, pool, rateModel, oracle, scoreEngine, tiers, registry, fund,
                healthMonitor, vault, transactions, properties, clock);
        this.auctioneer = new LiquidationAuctioneer(new AuctionRepository(jdbc), ledger, registry, lending,
                healthMonitor, scoreEngine, gate, transactions, properties, clock);

        CreditProperties.Principals p = properties.getPrincipals();
        gate.bootstrap(ADMIN, Capability.ADMIN);
        gate.bootstrap(p.getLendingEngine(), Capability.LEDGER_WRITER);
        gate.bootstrap(p.getLendingEngine(), Capability.FUND_REQUESTOR);
        gate.bootstrap(p.getAuctioneer(), Capability.LEDGER_WRITER);
        gate.bootstrap(WRITER, Capability.LEDGER_WRITER);
        gate.bootstrap(REPORTER, Capability.ACTIVITY_REPORTER);
        gate.bootstrap(ATTESTER, Capability.ATTESTER);

        priceFeed.setPrice(WETH, "2000");
        priceFeed.setPrice(WBTC, "60000");
    }

    /** Mints {@code amount} of {@code asset} to {@code account} and lets the protocol pull all of it. */
    public void fund(String account, String asset, String amount) {
        BigDecimal value = new BigDecimal(amount);
        vault.mint(account, asset, value);
        vault.approve(account, SystemAccounts.PROTOCOL, asset,
                vault.allowance(account, SystemAccounts.PROTOCOL, asset).add(value));
    }

    /** Lets the protocol pull any amount of {@code asset} from {@code account}. */
    public void approveAll(String account, String asset) {
        vault.approve(account, SystemAccounts.PROTOCOL, asset, new BigDecimal("1000000000"));
    }

    public void seedPool(String amount) {
        fund(LP, USDC, amount);
        pool.deposit(LP, new BigDecimal(amount));
    }

    /**
     * Gives {@code subject} a full sybil factor: live proof, wallet older than a year, 10k stake
     * and ten governance votes (participation 50).
     */
    public void makeSybilResistant(String subject) {
        identityRepository.saveProof(new IdentityProof(subject, "0x" + "ab".repeat(32), START,
                START.plus(Duration.ofDays(365))));
        identityRepository.touchFirstSeen(subject, START.minus(Duration.ofDays(400)));
        identityRepository.saveStake(new StakeCommitment(subject, new BigDecimal("10000"), Instant.EPOCH));
        for (int i = 0; i < 10; i++) {
            identityRepository.incrementVotes(subject);
        }
    }

    /** One loan of 1000 against 2000 of collateral, repaid in full: repayment and collateral factors at 100. */
    public void giveCleanHistory(String subject) {
        long loanId = registry.registerLoan(WRITER, subject, new BigDecimal("1000"), WRITER);
        registry.recordCollateral(WRITER, loanId, WETH, new BigDecimal("2000"), 800);
        registry.registerRepayment(WRITER, loanId, new BigDecimal("1000"));
    }

    @Override
    public void close() {
        database.shutdown();
    }
}
