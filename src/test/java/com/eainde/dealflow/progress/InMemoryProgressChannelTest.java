package com.eainde.dealflow.progress;

import com.eainde.dealflow.model.EventStatus;
import com.eainde.dealflow.model.ProgressEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class InMemoryProgressChannelTest {

    private static final String RUN = "run-1";

    private InMemoryProgressChannel channel;

    @BeforeEach
    void setUp() {
        channel = new InMemoryProgressChannel(Runnable::run);
    }

    private static ProgressEvent stage(int index) {
        return ProgressEvent.processing(RUN, "stage-" + index, index, 3, "Stage " + index);
    }

    /** Records events and whether the channel closed it. */
    private static final class Recorder implements ProgressListener {
        private final List<ProgressEvent> events = new ArrayList<>();
        private boolean closed;

        @Override
        public void onEvent(ProgressEvent event) {
            events.add(event);
        }

        @Override
        public void onClose() {
            closed = true;
        }

        List<Integer> indices() {
            return events.stream().map(ProgressEvent::stageIndex).toList();
        }
    }

    @Nested
    @DisplayName("subscribe")
    class Subscribe {

        @Test
        void subscribe_shouldReplayLastEvent_toLateSubscriber() {
            channel.publish(stage(0));
            channel.publish(stage(1));
            Recorder recorder = new Recorder();

            channel.subscribe(RUN, recorder);
            channel.publish(stage(2));

            assertThat(recorder.indices()).containsExactly(1, 2);
        }

        @Test
        void subscribe_shouldReceiveTerminalEventAndEnd_whenRunAlreadyFinished() {
            channel.publish(stage(0));
            channel.publish(ProgressEvent.completed(RUN, 3, "done", Map.of("score", 1)));
            Recorder recorder = new Recorder();

            Subscription subscription = channel.subscribe(RUN, recorder);

            assertThat(recorder.events).singleElement()
                    .satisfies(event -> assertThat(event.status()).isEqualTo(EventStatus.COMPLETED));
            assertThat(recorder.closed).isTrue();
            assertThat(subscription.isActive()).isFalse();
        }

        @Test
        void subscribe_shouldDeliverNothing_beforeFirstPublish() {
            Recorder recorder = new Recorder();

            Subscription subscription = channel.subscribe(RUN, recorder);

            assertThat(recorder.events).isEmpty();
            assertThat(subscription.isActive()).isTrue();
            assertThat(subscription.runId()).isEqualTo(RUN);
        }
    }

    @Nested
    @DisplayName("publish")
    class Publish {

        @Test
        void publish_shouldCloseAllSubscribers_onTerminalEvent() {
            Recorder first = new Recorder();
            Recorder second = new Recorder();
            channel.subscribe(RUN, first);
            channel.subscribe(RUN, second);

            channel.publish(ProgressEvent.failed(RUN, 2, 3, "Stage 'x' failed"));
            channel.publish(stage(3));

            assertThat(first.closed).isTrue();
            assertThat(second.closed).isTrue();
            assertThat(first.indices()).containsExactly(2);
            assertThat(channel.lastEvent(RUN)).hasValueSatisfying(e -> assertThat(e.isTerminal()).isTrue());
            assertThat(channel.subscriberCount(RUN)).isZero();
        }

        @Test
        void publish_shouldPruneFailingListener_withoutAffectingOthers() {
            Recorder healthy = new Recorder();
            channel.subscribe(RUN, event -> {
                throw new IllegalStateException("connection reset");
            });
            channel.subscribe(RUN, healthy);

            channel.publish(stage(0));
            channel.publish(stage(1));

            assertThat(healthy.indices()).containsExactly(0, 1);
            assertThat(channel.subscriberCount(RUN)).isEqualTo(1);
        }

        @Test
        void publish_shouldNotReachClosedSubscription() {
            Recorder recorder = new Recorder();
            Subscription subscription = channel.subscribe(RUN, recorder);
            channel.publish(stage(0));

            subscription.close();
            channel.publish(stage(1));

            assertThat(recorder.indices()).containsExactly(0);
            assertThat(recorder.closed).isFalse();
        }

        @Test
        void publish_shouldKeepRunsIsolated() {
            Recorder other = new Recorder();
            channel.subscribe("run-2", other);

            channel.publish(stage(0));

            assertThat(other.events).isEmpty();
            assertThat(channel.lastEvent("run-2")).isEmpty();
        }
    }

    @Nested
    @DisplayName("delivery on a thread pool")
    class PooledDelivery {

        private ExecutorService delivery;
        private InMemoryProgressChannel pooled;

        @BeforeEach
        void setUp() {
            delivery = Executors.newCachedThreadPool();
            pooled = new InMemoryProgressChannel(delivery);
        }

        @AfterEach
        void tearDown() {
            delivery.shutdownNow();
        }

        @Test
        void publish_shouldReturnPromptly_whileListenerIsBlocked() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch slowClosed = new CountDownLatch(1);
            List<Integer> slowSeen = new CopyOnWriteArrayList<>();
            pooled.subscribe(RUN, new ProgressListener() {
                @Override
                public void onEvent(ProgressEvent event) throws InterruptedException {
                    release.await();
                    slowSeen.add(event.stageIndex());
                }

                @Override
                public void onClose() {
                    slowClosed.countDown();
                }
            });
            CountDownLatch fastClosed = new CountDownLatch(1);
            List<Integer> fastSeen = new CopyOnWriteArrayList<>();
            pooled.subscribe(RUN, new ProgressListener() {
                @Override
                public void onEvent(ProgressEvent event) {
                    fastSeen.add(event.stageIndex());
                }

                @Override
                public void onClose() {
                    fastClosed.countDown();
                }
            });

            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                pooled.publish(stage(0));
                pooled.publish(stage(1));
                pooled.publish(ProgressEvent.completed(RUN, 3, "done", Map.of()));
            });

            assertThat(fastClosed.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(fastSeen).containsExactly(0, 1, 3);
            assertThat(slowSeen).isEmpty();

            release.countDown();
            assertThat(slowClosed.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(slowSeen).containsExactly(0, 1, 3);
        }

        @Test
        void subscribe_shouldDropSubscriber_whenNoDeliveryThreadIsAvailable() {
            InMemoryProgressChannel saturated = new InMemoryProgressChannel(command -> {
                throw new RejectedExecutionException("busy");
            });
            Recorder recorder = new Recorder();

            Subscription subscription = saturated.subscribe(RUN, recorder);
            saturated.publish(stage(0));

            assertThat(subscription.isActive()).isFalse();
            assertThat(recorder.events).isEmpty();
            assertThat(saturated.subscriberCount(RUN)).isZero();
        }
    }

    @Test
    void forget_shouldDropCacheAndCloseSubscribers() {
        Recorder recorder = new Recorder();
        channel.subscribe(RUN, recorder);
        channel.publish(stage(0));

        channel.forget(RUN);

        assertThat(channel.lastEvent(RUN)).isEmpty();
        assertThat(recorder.closed).isTrue();
    }

    @Nested
    @DisplayName("stream")
    class Stream {

        @Test
        void stream_shouldIterateUntilTerminalEvent_acrossThreads() throws Exception {
            ProgressStream stream = channel.stream(RUN);
            CountDownLatch subscribed = new CountDownLatch(1);
            ExecutorService consumer = Executors.newSingleThreadExecutor();
            try {
                Future<List<Integer>> seen = consumer.submit(() -> {
                    subscribed.countDown();
                    List<Integer> indices = new ArrayList<>();
                    stream.forEachRemaining(event -> indices.add(event.stageIndex()));
                    return indices;
                });
                subscribed.await();

                channel.publish(stage(0));
                channel.publish(stage(1));
                channel.publish(ProgressEvent.completed(RUN, 3, "done", Map.of()));

                assertThat(seen.get(5, TimeUnit.SECONDS)).containsExactly(0, 1, 3);
            } finally {
                consumer.shutdownNow();
            }
        }

        @Test
        void poll_shouldReturnEmpty_onTimeout() throws InterruptedException {
            try (ProgressStream stream = channel.stream(RUN)) {
                assertThat(stream.poll(Duration.ofMillis(20))).isEmpty();
            }
        }

        @Test
        void close_shouldEndIteration_andUnsubscribe() {
            ProgressStream stream = channel.stream(RUN);

            stream.close();

            assertThat(stream.hasNext()).isFalse();
            assertThat(channel.subscriberCount(RUN)).isZero();
        }
    }
}
