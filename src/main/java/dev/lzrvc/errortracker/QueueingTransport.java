package dev.lzrvc.errortracker;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Moves delivery off the caller's thread. Events are handed to one background sender through a
 * bounded queue; when the queue is full the event is dropped and reported.
 */
public final class QueueingTransport implements Transport {

    private final Transport delegate;
    private final Diagnostics diagnostics;
    private final ThreadPoolExecutor executor;
    private final Object drainLock = new Object();
    private int pending;

    public QueueingTransport(Transport delegate, int maxQueueSize, Diagnostics diagnostics) {
        if (maxQueueSize < 1) throw new IllegalArgumentException("maxQueueSize must be positive: " + maxQueueSize);
        this.delegate    = delegate;
        this.diagnostics = diagnostics;
        this.executor    = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(maxQueueSize),
                runnable -> {
                    Thread t = new Thread(runnable, "error-tracker-sender");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public void send(Event event) {
        synchronized (drainLock) {
            pending++;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            completed();
            diagnostics.error("Send queue full or closed, dropping event " + event.getEventId(), null);
        }
    }

    private void deliver(Event event) {
        try {
            delegate.send(event);
        } catch (RuntimeException e) {
            diagnostics.error("Transport failed for event " + event.getEventId(), e);
        } finally {
            completed();
        }
    }

    private void completed() {
        synchronized (drainLock) {
            pending--;
            if (pending == 0) drainLock.notifyAll();
        }
    }

    @Override
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (drainLock) {
            while (pending > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    diagnostics.debug("Flush timed out with " + pending + " event(s) pending.");
                    return false;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(drainLock, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return delegate.flush(Duration.ofNanos(Math.max(0L, deadline - System.nanoTime())));
    }

    @Override
    public void close() {
        executor.shutdown();
        delegate.close();
    }

    int pending() {
        synchronized (drainLock) {
            return pending;
        }
    }
}
