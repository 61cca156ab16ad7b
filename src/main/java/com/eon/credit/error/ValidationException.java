package com.eon.credit.error;

/** Input failed a domain check (score range, tier, proof, amount). */
public class ValidationException extends CreditException {

    public ValidationException(CreditErrorCode code, String message) {
        super(code, message);
    }

    public ValidationException(CreditErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
