package com.eon.credit.ledger;

public enum LoanStatus {
    ACTIVE,
    REPAID,
    LIQUIDATED
}
