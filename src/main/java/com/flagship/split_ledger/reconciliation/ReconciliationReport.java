package com.flagship.split_ledger.reconciliation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of replaying a batch of mirror settlement events into the ledger.
 * {@code failures} maps transfer reference to error message.
 */
@Value
@Builder
public class ReconciliationReport {
    int recorded;
    int alreadyRecorded;
    @Singular
    Map<String, String> failures;

    public int total() {
        return recorded + alreadyRecorded + failures.size();
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
