package com.interviewpulse.aggregator.service.scheduling;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Base class for long-running loops hosted on a dedicated executor.
 *
 * <p>Template method: subclasses implement {@link #runOnce()}; the base handles start/stop,
 * error backoff and cooperative cancellation. A stop request is observed between iterations and
 * during {@link #pause(Duration)}, so an iteration in progress always completes.
 *
 * <p>Errors thrown by an iteration are logged and followed by an error backoff; they never end
 * the loop.
 */
public abstract class AbstractSchedulerLoop implements SmartLifecycle {

    private final Logger log = LogManager.getLogger(getClass());

    private final String name;
    private final Executor executor;
    private final Duration errorBackoff;
    private final boolean autoStartup;

    private final Object lifecycleLock = new Object();
    private volatile boolean running;
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private volatile CountDownLatch finished = new CountDownLatch(0);

    protected AbstractSchedulerLoop(String name, Executor executor, Duration errorBackoff, boolean autoStartup) {
        this.name = Objects.requireNonNull(name, "name");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.errorBackoff = Objects.requireNonNull(errorBackoff, "errorBackoff");
        this.autoStartup = autoStartup;
    }

    /**
     * One iteration of the loop. May block, but should return within a bounded time so a stop
     * request is noticed.
     */
    protected abstract void runOnce() throws Exception;

    /** Called on the loop thread after the last iteration. */
    protected void onExit() {
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            stopSignal = new CountDownLatch(1);
            finished = new CountDownLatch(1);
            running = true;
        }
        executor.execute(this::loop);
        log.info("{} started", name);
    }

    private void loop() {
        try {
            while (!stopRequested()) {
                try {
                    runOnce();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("{} interrupted, exiting", name);
                    return;
                } catch (Exception e) {
                    log.error("{} iteration failed, backing off {} ms", name, errorBackoff.toMillis(), e);
                    if (pause(errorBackoff)) {
                        return;
                    }
                }
            }
        } finally {
            try {
                onExit();
            } catch (RuntimeException e) {
                log.warn("{} cleanup failed: {}", name, e.toString());
            }
            running = false;
            finished.countDown();
            log.info("{} stopped", name);
        }
    }

    /** Requests a stop and waits until the current iteration has finished. */
    @Override
    public void stop() {
        stopSignal.countDown();
        try {
            if (!finished.await(shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} did not stop within {} ms", name, shutdownTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    public String getName() {
        return name;
    }

    /** Upper bound {@link #stop()} waits for the loop thread. */
    protected Duration shutdownTimeout() {
        return Duration.ofSeconds(30);
    }

    protected boolean stopRequested() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Sleeps up to {@code duration}, waking early on a stop request.
     *
     * @return true when a stop was requested
     */
    protected boolean pause(Duration duration) {
        try {
            return stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
