package com.eon.credit.error;

import lombok.Getter;

/**
 * Base exception for every rejected ledger or lending operation.
 * Subclasses mark the category, the {@link CreditErrorCode} names the precise reason.
 */
@Getter
public abstract class CreditException extends RuntimeException {

    private final CreditErrorCode code;

    protected CreditException(CreditErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected CreditException(CreditErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
