package com.giftcard.fraudguard.api;

/**
 * Thrown when the gift-card store cannot be reached in time (timeout, error or open circuit).
 * Redemptions fail closed on it: the handler returns HTTP 503 and nothing is redeemed.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
