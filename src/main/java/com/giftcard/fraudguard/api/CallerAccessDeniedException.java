package com.giftcard.fraudguard.api;

public class CallerAccessDeniedException extends RuntimeException {

    public CallerAccessDeniedException(String message) {
        super(message);
    }
}
