package com.eon.credit.error;

/** Referenced loan, auction or subject does not exist. */
public class NotFoundException extends CreditException {

    public NotFoundException(CreditErrorCode code, String message) {
        super(code, message);
    }

    public NotFoundException(CreditErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
