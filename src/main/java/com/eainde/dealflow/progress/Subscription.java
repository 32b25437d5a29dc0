package com.eainde.dealflow.progress;

/**
 * Handle of one listener's interest in a run.
 */
public interface Subscription extends AutoCloseable {

    String runId();

    boolean isActive();

    /** Stops delivery. Closing twice is a no-op. */
    @Override
    void close();
}
