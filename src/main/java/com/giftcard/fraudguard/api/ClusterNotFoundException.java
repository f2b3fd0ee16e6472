package com.giftcard.fraudguard.api;

/**
 * Thrown when an admin asks for a cluster id that does not exist (HTTP 404).
 */
public class ClusterNotFoundException extends RuntimeException {

    public ClusterNotFoundException(String message) {
        super(message);
    }
}
