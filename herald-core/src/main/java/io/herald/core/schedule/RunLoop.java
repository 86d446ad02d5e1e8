package io.herald.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide driver: polls the scheduler on one thread and sleeps {@code pollInterval} between polls.
 */
public final class RunLoop implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RunLoop.class);

    private final SafeScheduler scheduler;
    private final Clock clock;
    private final Duration pollInterval;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean running;
    private final AtomicLong polls;

    public RunLoop(SafeScheduler scheduler, Clock clock, Duration pollInterval) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollInterval = pollInterval;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "herald-run-loop");
            thread.setDaemon(true);
            return thread;
        });
        this.running = new AtomicBoolean(false);
        this.polls = new AtomicLong();
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        executor.scheduleWithFixedDelay(this::poll, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Run loop started, polling every {} ms", pollInterval.toMillis());
    }

    /**
     * One scheduler pass. Never throws: an exception escaping here would cancel the periodic task.
     */
    public void poll() {
        polls.incrementAndGet();
        try {
            RunReport report = scheduler.runDue(clock.instant());
            if (report.failed() > 0) {
                LOG.debug("Poll finished with failed jobs {}", report.failedJobs());
            }
        } catch (Throwable e) {
            LOG.error("Scheduler pass failed", e);
        }
    }

    public long polls() {
        return polls.get();
    }

    public boolean isRunning() {
        return running.get() && !executor.isShutdown();
    }

    @Override
    public void close() {
        running.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Run loop stopped after {} polls", polls.get());
    }
}
