package com.eon.credit.controller;

/**
 * Principal of the request. Authentication happens in the gateway in front of this service,
 * which forwards the verified principal in this header.
 */
final class CallerHeader {
    static final String NAME = "X-Caller";

    private CallerHeader() {}
}
