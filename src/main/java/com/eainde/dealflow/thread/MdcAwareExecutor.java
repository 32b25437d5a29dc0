package com.eainde.dealflow.thread;

import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Platform thread pool that carries the submitter's MDC onto the task thread
 * and clears it afterwards.
 * <p>
 * Tasks are handed straight to a thread: the pool starts a new one whenever
 * all are busy, up to {@code maxSize}, and rejects beyond that instead of
 * queueing work behind tasks that may block for a long time.
 * </p>
 */
public class MdcAwareExecutor implements Executor {

    private final ThreadPoolExecutor delegate;

    public MdcAwareExecutor(String threadPrefix, int coreSize, int maxSize) {
        this.delegate = new ThreadPoolExecutor(
                coreSize,
                Math.max(Math.max(coreSize, maxSize), 1),
                60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                namedThreads(threadPrefix),
                new ThreadPoolExecutor.AbortPolicy());
        this.delegate.allowCoreThreadTimeOut(true);
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    /** Lets running tasks finish; used as the bean's destroy method. */
    public void shutdown() {
        delegate.shutdown();
    }

    public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
    }

    public int activeCount() {
        return delegate.getActiveCount();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }
}
