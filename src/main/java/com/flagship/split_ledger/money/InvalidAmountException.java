package com.flagship.split_ledger.money;

/**
 * Raised wherever an amount is accepted and it is missing, malformed or not positive.
 * Always thrown before any state change.
 */
public class InvalidAmountException extends IllegalArgumentException {

    public InvalidAmountException(String message) {
        super(message);
    }
}
