package com.eainde.dealflow.progress;

import com.eainde.dealflow.model.ProgressEvent;

import java.util.Optional;

/**
 * Publish/subscribe of progress events keyed by run id.
 * <p>
 * The last event of every run is retained: a subscriber joining late receives
 * it immediately, and a subscriber joining after the terminal event receives
 * that event and is closed straight away.
 * </p>
 */
public interface ProgressChannel {

    /** Delivers {@code event} to every live subscriber of {@code event.runId()}. */
    void publish(ProgressEvent event);

    Subscription subscribe(String runId, ProgressListener listener);

    /** Pull-style subscription; the stream ends after a terminal event. */
    ProgressStream stream(String runId);

    Optional<ProgressEvent> lastEvent(String runId);

    /** Drops the retained event and closes any subscription left for the run. */
    void forget(String runId);
}
