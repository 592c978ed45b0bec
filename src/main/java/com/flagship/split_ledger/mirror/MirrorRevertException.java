package com.flagship.split_ledger.mirror;

/**
 * A mirror contract call was rejected. No state was changed by the rejected call.
 *
 * {@link #getReason()} carries the contract's revert reason verbatim, e.g.
 * {@code "Not a group member"}.
 */
public class MirrorRevertException extends RuntimeException {

    private final String reason;

    public MirrorRevertException(String reason) {
        super(reason);
        this.reason = reason;
    }

    public MirrorRevertException(String reason, Throwable cause) {
        super(reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
