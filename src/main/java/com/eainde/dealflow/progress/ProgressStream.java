package com.eainde.dealflow.progress;

import com.eainde.dealflow.model.ProgressEvent;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Blocking iterator over a run's events. {@link #hasNext()} waits for the next
 * event and returns {@code false} once the run has ended or the stream is closed.
 * Not thread safe; one consumer per stream.
 */
public class ProgressStream implements Iterator<ProgressEvent>, ProgressListener, AutoCloseable {

    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private Subscription subscription;
    private ProgressEvent next;
    private boolean ended;

    void attach(Subscription subscription) {
        this.subscription = subscription;
    }

    @Override
    public void onEvent(ProgressEvent event) {
        queue.offer(event);
    }

    @Override
    public void onClose() {
        queue.offer(END);
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (ended) {
            return false;
        }
        try {
            return accept(queue.take());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            ended = true;
            return false;
        }
    }

    @Override
    public ProgressEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Progress stream has ended");
        }
        ProgressEvent event = next;
        next = null;
        return event;
    }

    /**
     * Next event, waiting at most {@code timeout}; empty on timeout or after the end.
     */
    public Optional<ProgressEvent> poll(Duration timeout) throws InterruptedException {
        if (next == null && !ended) {
            Object item = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (item == null || !accept(item)) {
                return Optional.empty();
            }
        }
        if (next == null) {
            return Optional.empty();
        }
        ProgressEvent event = next;
        next = null;
        return Optional.of(event);
    }

    private boolean accept(Object item) {
        if (item == END) {
            ended = true;
            return false;
        }
        next = (ProgressEvent) item;
        return true;
    }

    @Override
    public void close() {
        if (subscription != null) {
            subscription.close();
        }
        queue.offer(END);
    }
}
