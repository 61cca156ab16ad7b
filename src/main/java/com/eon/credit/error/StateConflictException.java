package com.eon.credit.error;

/** Operation is not valid in the current state of the loan, auction, stake or attestation. */
public class StateConflictException extends CreditException {

    public StateConflictException(CreditErrorCode code, String message) {
        super(code, message);
    }

    public StateConflictException(CreditErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
