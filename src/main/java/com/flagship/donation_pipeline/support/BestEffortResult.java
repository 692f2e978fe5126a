package com.flagship.donation_pipeline.support;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Outcome of a side effect that is allowed to fail: pending-record bookkeeping,
 * receipt emails, cache writes.
 *
 * A failed result has already been logged. Callers may inspect it but must not
 * turn it back into an exception.
 */
@Slf4j
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class BestEffortResult {

    private static final BestEffortResult SUCCEEDED = new BestEffortResult(null, true, null);

    private final String operation;
    private final boolean succeeded;
    private final Exception failure;

    public static BestEffortResult succeeded() {
        return SUCCEEDED;
    }

    public static BestEffortResult skipped(String operation, String reason) {
        log.debug("Skipped {}: {}", operation, reason);
        return new BestEffortResult(operation, true, null);
    }

    public static BestEffortResult failed(String operation, Exception failure) {
        log.warn("Best-effort operation '{}' failed: {}", operation, failure.getMessage());
        return new BestEffortResult(operation, false, failure);
    }

    /**
     * Runs {@code action}, converting any exception into a failed result.
     */
    public static BestEffortResult attempt(String operation, Runnable action) {
        try {
            action.run();
            return SUCCEEDED;
        } catch (Exception e) {
            return failed(operation, e);
        }
    }

    public Optional<Exception> failure() {
        return Optional.ofNullable(failure);
    }
}
