package com.eon.credit.auth;

/** What a principal on the allow-list may do. Capabilities are independent, none implies another. */
public enum Capability {
    ADMIN,
    LEDGER_WRITER,
    FUND_REQUESTOR,
    ATTESTER,
    ACTIVITY_REPORTER
}
