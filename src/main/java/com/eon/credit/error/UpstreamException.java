package com.eon.credit.error;

/** An external read (price feed, reputation aggregator) failed or returned unusable data. */
public class UpstreamException extends CreditException {

    public UpstreamException(CreditErrorCode code, String message) {
        super(code, message);
    }

    public UpstreamException(CreditErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
