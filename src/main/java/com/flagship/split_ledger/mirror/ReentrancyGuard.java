package com.flagship.split_ledger.mirror;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Single non-reentrant guarded section.
 *
 * At most one section runs at a time. Entering while a section is open, including from the
 * same thread through a callback, fails with {@link ReentrantCallException} and leaves the
 * open section untouched.
 */
public final class ReentrancyGuard {

    private final AtomicBoolean entered = new AtomicBoolean(false);

    public <T> T call(Supplier<T> section) {
        if (!entered.compareAndSet(false, true)) {
            throw new ReentrantCallException();
        }
        try {
            return section.get();
        } finally {
            entered.set(false);
        }
    }

    public void run(Runnable section) {
        call(() -> {
            section.run();
            return null;
        });
    }
}
