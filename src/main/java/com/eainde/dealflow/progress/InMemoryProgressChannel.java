package com.eainde.dealflow.progress;

import com.eainde.dealflow.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local {@link ProgressChannel}.
 * <p>
 * Each run id has its own topic and its own lock, so runs never contend with
 * each other. Publishing only appends to every subscriber's mailbox under the
 * topic lock; the delivery executor drains each mailbox on its own, one task
 * at a time per subscriber. A slow listener therefore delays nobody but
 * itself, and still sees the run's events in publish order. A listener that
 * throws is marked dead and removed on the next publish.
 * </p>
 */
@Slf4j
@Component
public class InMemoryProgressChannel implements ProgressChannel {

    private static final Object END = new Object();

    private final Map<String, Topic> topics = new ConcurrentHashMap<>();
    private final Executor deliveryExecutor;

    public InMemoryProgressChannel(@Qualifier("progressExecutor") Executor deliveryExecutor) {
        this.deliveryExecutor = deliveryExecutor;
    }

    @Override
    public void publish(ProgressEvent event) {
        Topic topic = topics.computeIfAbsent(event.runId(), Topic::new);
        synchronized (topic) {
            if (topic.ended) {
                log.warn("Run {} already ended, dropping '{}' event", event.runId(), event.stage());
                return;
            }
            topic.last = event;
            topic.subscribers.removeIf(handle -> !handle.isActive());
            for (Handle handle : topic.subscribers) {
                handle.offer(event);
            }
            if (event.isTerminal()) {
                topic.ended = true;
                closeAll(topic);
            }
        }
    }

    @Override
    public Subscription subscribe(String runId, ProgressListener listener) {
        Topic topic = topics.computeIfAbsent(runId, Topic::new);
        Handle handle = new Handle(topic, listener);
        synchronized (topic) {
            if (topic.last != null) {
                handle.offer(topic.last);
            }
            if (topic.ended) {
                handle.end();
            } else if (handle.isActive()) {
                topic.subscribers.add(handle);
            }
        }
        return handle;
    }

    @Override
    public ProgressStream stream(String runId) {
        ProgressStream stream = new ProgressStream();
        stream.attach(subscribe(runId, stream));
        return stream;
    }

    @Override
    public Optional<ProgressEvent> lastEvent(String runId) {
        Topic topic = topics.get(runId);
        if (topic == null) {
            return Optional.empty();
        }
        synchronized (topic) {
            return Optional.ofNullable(topic.last);
        }
    }

    @Override
    public void forget(String runId) {
        Topic topic = topics.remove(runId);
        if (topic != null) {
            synchronized (topic) {
                closeAll(topic);
            }
            log.debug("Forgot progress of run {}", runId);
        }
    }

    int subscriberCount(String runId) {
        Topic topic = topics.get(runId);
        if (topic == null) {
            return 0;
        }
        synchronized (topic) {
            return (int) topic.subscribers.stream().filter(Handle::isActive).count();
        }
    }

    private static void closeAll(Topic topic) {
        List<Handle> open = new ArrayList<>(topic.subscribers);
        topic.subscribers.clear();
        open.forEach(Handle::end);
    }

    private static final class Topic {
        private final String runId;
        private final List<Handle> subscribers = new ArrayList<>();
        private ProgressEvent last;
        private boolean ended;

        private Topic(String runId) {
            this.runId = runId;
        }
    }

    private final class Handle implements Subscription {
        private final Topic topic;
        private final ProgressListener listener;
        private final Queue<Object> mailbox = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean();
        // false once the consumer closed it or the listener failed
        private volatile boolean open = true;
        private volatile boolean ended;

        private Handle(Topic topic, ProgressListener listener) {
            this.topic = topic;
            this.listener = listener;
        }

        @Override
        public String runId() {
            return topic.runId;
        }

        @Override
        public boolean isActive() {
            return open && !ended;
        }

        @Override
        public void close() {
            open = false;
        }

        private void end() {
            ended = true;
            offer(END);
        }

        private void offer(Object item) {
            mailbox.add(item);
            schedule();
        }

        private void schedule() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                deliveryExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                log.warn("No delivery thread for a subscriber of run {}, dropping it", topic.runId);
                open = false;
                mailbox.clear();
                draining.set(false);
            }
        }

        private void drain() {
            do {
                Object item;
                while ((item = mailbox.poll()) != null) {
                    dispatch(item);
                }
                draining.set(false);
            } while (!mailbox.isEmpty() && draining.compareAndSet(false, true));
        }

        private void dispatch(Object item) {
            if (!open) {
                return;
            }
            if (item == END) {
                open = false;
                try {
                    listener.onClose();
                } catch (RuntimeException e) {
                    log.debug("Subscriber of run {} failed on close: {}", topic.runId, e.toString());
                }
                return;
            }
            ProgressEvent event = (ProgressEvent) item;
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.debug("Subscriber of run {} failed, pruning it: {}", event.runId(), e.toString());
                open = false;
            }
        }
    }
}
