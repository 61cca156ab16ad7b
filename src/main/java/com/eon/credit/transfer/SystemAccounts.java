package com.eon.credit.transfer;

/** Accounts held by the protocol itself. */
public final class SystemAccounts {

    /** Spender that subjects approve before borrowing, staking or posting a bond. */
    public static final String PROTOCOL = "eon-protocol";

    public static final String POOL = "pool";
    public static final String COLLATERAL_ESCROW = "collateral-escrow";
    public static final String INSURANCE_FUND = "insurance-fund";
    public static final String TREASURY = "treasury";
    public static final String STAKE_ESCROW = "stake-escrow";
    public static final String BOND_ESCROW = "bond-escrow";

    private SystemAccounts() {}
}
