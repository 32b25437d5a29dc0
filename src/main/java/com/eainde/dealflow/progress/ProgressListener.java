package com.eainde.dealflow.progress;

import com.eainde.dealflow.model.ProgressEvent;

/**
 * Push-style receiver of a run's progress events. Called on a delivery thread,
 * never on the run's own thread, one event at a time and in publish order.
 */
public interface ProgressListener {

    /**
     * @throws Exception when the receiver is gone; the subscription is dropped
     *                   on the next publish
     */
    void onEvent(ProgressEvent event) throws Exception;

    /** No event follows. */
    default void onClose() {
    }
}
