package com.eainde.dealflow.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdcAwareExecutorTest {

    private MdcAwareExecutor executor;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        executor = new MdcAwareExecutor("test-run-", 4, 8);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
        MDC.clear();
    }

    private void submitBlocked(int count, CountDownLatch started) {
        for (int i = 0; i < count; i++) {
            executor.execute(() -> {
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
    }

    @Test
    void execute_shouldStartFifthTask_whileCoreThreadsAreBlocked() throws InterruptedException {
        CountDownLatch blocked = new CountDownLatch(4);
        submitBlocked(4, blocked);
        assertThat(blocked.await(5, TimeUnit.SECONDS)).isTrue();

        CountDownLatch fifthStarted = new CountDownLatch(1);
        executor.execute(fifthStarted::countDown);

        assertThat(fifthStarted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void execute_shouldReject_whenEveryThreadIsBusy() throws InterruptedException {
        CountDownLatch blocked = new CountDownLatch(8);
        submitBlocked(8, blocked);
        assertThat(blocked.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> executor.execute(() -> { }))
                .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void execute_shouldCarrySubmitterMdc_ontoTaskThread() throws InterruptedException {
        MDC.put("runId", "run-7");
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            seen.set(MDC.get("runId"));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("run-7");
    }
}
