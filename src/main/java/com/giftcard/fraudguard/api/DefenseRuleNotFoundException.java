package com.giftcard.fraudguard.api;

public class DefenseRuleNotFoundException extends RuntimeException {

    public DefenseRuleNotFoundException(String message) {
        super(message);
    }
}
