package com.eainde.atlas.thread;

import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool that carries the submitting thread's MDC (run id included) into the task.
 * Futures returned by {@code submit} interrupt their worker on {@code cancel(true)}.
 */
public class MdcAwareExecutor extends AbstractExecutorService implements AutoCloseable {

    private final ExecutorService delegate;

    public MdcAwareExecutor(String namePrefix, int poolSize) {
        this.delegate = Executors.newFixedThreadPool(poolSize, namedDaemonThreads(namePrefix));
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> submitterMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (submitterMdc != null) {
                MDC.setContextMap(submitterMdc);
            } else {
                MDC.clear();
            }
            try {
                command.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        });
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    @Override
    public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    @Override
    public boolean isTerminated() {
        return delegate.isTerminated();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return delegate.awaitTermination(timeout, unit);
    }

    @Override
    public void close() {
        delegate.shutdownNow();
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
