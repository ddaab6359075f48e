package com.phillippitts.cvtailor.service.progress;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Hands events to a delegate on a dedicated thread so a slow subscriber cannot stall the run.
 *
 * <p>One thread per subscriber preserves order. When the buffer is full, or the delegate has
 * failed, {@link #onEvent} throws and {@link ProgressLog} detaches this observer. The worker
 * thread stops as soon as the delegate fails.
 */
public final class BufferedProgressObserver implements ProgressObserver {

    private static final Logger LOG = LogManager.getLogger(BufferedProgressObserver.class);

    private final ProgressObserver delegate;
    private final ThreadPoolExecutor worker;
    private volatile boolean failed;

    public BufferedProgressObserver(ProgressObserver delegate, int capacity, String name) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity), runnable -> {
                    Thread thread = new Thread(runnable, name);
                    thread.setDaemon(true);
                    return thread;
                }, new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public void onEvent(ProgressEvent event) {
        if (failed) {
            worker.shutdownNow();
            throw new IllegalStateException("Subscriber already failed");
        }
        try {
            worker.execute(() -> forward(event));
        } catch (RejectedExecutionException e) {
            failed = true;
            worker.shutdownNow();
            throw new IllegalStateException("Subscriber buffer full", e);
        }
    }

    @Override
    public void onClose() {
        try {
            worker.execute(this::closeDelegate);
        } catch (RejectedExecutionException e) {
            LOG.debug("Subscriber closed without draining: {}", e.toString());
        }
        worker.shutdown();
    }

    private void forward(ProgressEvent event) {
        if (failed) {
            return;
        }
        try {
            delegate.onEvent(event);
        } catch (RuntimeException e) {
            failed = true;
            worker.shutdown();
            LOG.debug("Subscriber delivery failed at sequence {}: {}", event.sequence(), e.toString());
        }
    }

    // Package-private for tests
    boolean isTerminated() {
        return worker.isTerminated();
    }

    private void closeDelegate() {
        try {
            delegate.onClose();
        } catch (RuntimeException e) {
            LOG.debug("Subscriber close failed: {}", e.toString());
        }
    }
}
