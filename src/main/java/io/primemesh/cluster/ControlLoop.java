package io.primemesh.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs one body repeatedly on a dedicated daemon thread with a fixed idle delay
 * between runs. A failing run is logged and the loop carries on.
 */
final class ControlLoop {
    private static final Logger LOG = LoggerFactory.getLogger(ControlLoop.class);

    private final String threadName;
    private final Duration delay;
    private final Runnable body;
    private ScheduledExecutorService scheduler;

    ControlLoop(String threadName, Duration delay, Runnable body) {
        this.threadName = threadName;
        this.delay = delay;
        this.body = body;
    }

    synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::runOnce, 0L, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops scheduling and waits up to {@code timeout} for the current run.
     *
     * @return true when the loop thread finished within the timeout
     */
    boolean stop(Duration timeout) {
        ScheduledExecutorService current;
        synchronized (this) {
            current = scheduler;
        }
        if (current == null) {
            return true;
        }
        current.shutdown();
        try {
            if (current.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            LOG.warn("Control loop {} did not finish within {}ms, interrupting", threadName, timeout.toMillis());
            current.shutdownNow();
            return false;
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void runOnce() {
        try {
            body.run();
        } catch (RuntimeException e) {
            LOG.error("Control loop {} tick failed", threadName, e);
        }
    }
}
