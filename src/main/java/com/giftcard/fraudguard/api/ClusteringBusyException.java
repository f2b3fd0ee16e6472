package com.giftcard.fraudguard.api;

/**
 * Thrown when a manual threat-analysis trigger cannot acquire the run lock in time.
 * Handler returns HTTP 409 so the caller can retry once the running analysis finishes.
 */
public class ClusteringBusyException extends RuntimeException {

    public ClusteringBusyException(String message) {
        super(message);
    }

    public ClusteringBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
