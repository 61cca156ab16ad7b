package com.eon.credit.error;

/** Caller lacks the capability required by the operation. */
public class AuthorizationException extends CreditException {

    public AuthorizationException(CreditErrorCode code, String message) {
        super(code, message);
    }

    public AuthorizationException(CreditErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
