package com.flagship.split_ledger.mirror;

/**
 * A value transfer did not happen. Nothing moved.
 */
public abstract class TransferFailedException extends RuntimeException {

    protected TransferFailedException(String message) {
        super(message);
    }
}
