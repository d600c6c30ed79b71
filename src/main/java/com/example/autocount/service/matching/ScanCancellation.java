package com.example.autocount.service.matching;

import com.example.autocount.exception.SearchCancelledException;

import java.time.Duration;

/**
 * Cooperative cancellation handle shared by the scans of one search. Scanners call
 * {@link #checkpoint()} between units of work; the handle trips either when {@link #cancel()}
 * is invoked or when its deadline passes.
 */
public final class ScanCancellation {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final long deadlineNanos;
    private volatile boolean cancelled;

    private ScanCancellation(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static ScanCancellation none() {
        return new ScanCancellation(NO_DEADLINE);
    }

    public static ScanCancellation withTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return none();
        }
        return new ScanCancellation(System.nanoTime() + timeout.toNanos());
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0);
    }

    public void checkpoint() {
        if (cancelled) {
            throw new SearchCancelledException("Search was cancelled");
        }
        if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) {
            throw new SearchCancelledException("Search exceeded its deadline");
        }
    }
}
