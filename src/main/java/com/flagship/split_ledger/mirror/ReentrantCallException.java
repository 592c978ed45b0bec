package com.flagship.split_ledger.mirror;

/**
 * A state-changing mirror call was attempted while another one was still in progress on the
 * same contract instance. Fatal to the nested call only.
 */
public class ReentrantCallException extends IllegalStateException {

    public ReentrantCallException() {
        super("ReentrancyGuard: reentrant call");
    }
}
