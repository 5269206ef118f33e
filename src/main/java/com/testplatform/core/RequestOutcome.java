package com.testplatform.core;

/**
 * Result of one discovery or run request.
 *
 * @param success   Whether the request completed
 * @param errorKind Failure classification, null on success
 * @param message   Failure message, null on success
 */
public record RequestOutcome(boolean success, ErrorKind errorKind, String message) {

    public static RequestOutcome succeeded() {
        return new RequestOutcome(true, null, null);
    }

    public static RequestOutcome failed(ErrorKind errorKind, String message) {
        return new RequestOutcome(false, errorKind, message);
    }
}
