package com.eon.credit.error;

/** Not enough liquidity, collateral headroom, bond or balance to complete the operation. */
public class ResourceException extends CreditException {

    public ResourceException(CreditErrorCode code, String message) {
        super(code, message);
    }

    public ResourceException(CreditErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
