package io.herald.core.schedule;

import io.herald.core.notify.FailureNotifier;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs registered jobs when they are due and keeps going when one of them fails.
 *
 * <p>Jobs execute sequentially in registration order, one pass at a time. A failing callback is contained
 * at the job boundary: it is written to the {@code herald.failures} log, reported through the
 * {@link FailureNotifier}, and rescheduled through the {@link ReschedulePolicy}. Nothing a callback throws
 * can abort the pass or touch any job other than the one executing.
 *
 * <p>Callbacks run outside the scheduler monitor, so {@link #snapshot()} and {@link #register(JobSpec)}
 * stay responsive while a slow job is in flight.
 */
public final class SafeScheduler {
    public static final String FAILURE_LOGGER = "herald.failures";

    private static final Logger LOG = LoggerFactory.getLogger(SafeScheduler.class);
    private static final Logger FAILURES = LoggerFactory.getLogger(FAILURE_LOGGER);

    private final Clock clock;
    private final ZoneId zone;
    private final ReschedulePolicy reschedulePolicy;
    private final FailureNotifier notifier;
    private final List<Job> jobs = new ArrayList<>();
    private final Object passLock = new Object();

    public SafeScheduler(Clock clock, ZoneId zone, ReschedulePolicy reschedulePolicy, FailureNotifier notifier) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.reschedulePolicy = Objects.requireNonNull(reschedulePolicy, "reschedulePolicy must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
    }

    public SafeScheduler(Clock clock, ZoneId zone, boolean rescheduleOnFailure, FailureNotifier notifier) {
        this(clock, zone, ReschedulePolicy.of(rescheduleOnFailure), notifier);
    }

    public synchronized JobHandle register(JobSpec spec) {
        if (spec == null) {
            throw new ScheduleConfigException("job spec is required");
        }
        Instant now = clock.instant();
        Job job = new Job(spec, spec.recurrence().next(now, zone));
        jobs.add(job);
        LOG.info("Registered job {} ({}), first run at {}", spec.name(), spec.recurrence().describe(), job.nextRun());
        return job;
    }

    public synchronized List<JobHandle> jobs() {
        return List.copyOf(jobs);
    }

    public synchronized List<JobHandle> dueJobs(Instant now) {
        List<JobHandle> due = new ArrayList<>();
        for (Job job : jobs) {
            if (job.isDue(now)) {
                due.add(job);
            }
        }
        return due;
    }

    public synchronized Optional<Instant> nextRunAt() {
        return jobs.stream().map(Job::nextRun).min(Instant::compareTo);
    }

    public RunReport runPending() {
        return runDue(clock.instant());
    }

    public RunReport runDue(Instant now) {
        synchronized (passLock) {
            List<Job> due = collectDue(now);
            List<String> failed = new ArrayList<>();
            for (Job job : due) {
                if (!execute(job, now)) {
                    failed.add(job.name());
                }
            }
            if (!due.isEmpty()) {
                LOG.debug("Scheduler pass at {}: {} executed, {} failed", now, due.size(), failed.size());
            }
            return new RunReport(due.size(), failed);
        }
    }

    public synchronized List<JobSnapshot> snapshot() {
        return jobs.stream().map(JobSnapshot::of).toList();
    }

    private synchronized List<Job> collectDue(Instant now) {
        List<Job> due = new ArrayList<>();
        for (Job job : jobs) {
            if (job.isDue(now)) {
                due.add(job);
            }
        }
        return due;
    }

    private boolean execute(Job job, Instant now) {
        MDC.put("job", job.name());
        try {
            JobOutcome outcome = invoke(job);
            Instant advanced = job.recurrence().next(now, zone);
            if (outcome.success()) {
                job.attempted(now, advanced, outcome);
                LOG.debug("Job {} succeeded, next run at {}", job.name(), advanced);
                return true;
            }

            report(job, outcome);
            Instant next = reschedulePolicy.nextRunAfterFailure(job, now, advanced);
            job.attempted(now, next == null ? advanced : next, outcome);
            LOG.info("Job {} failed, next run at {}", job.name(), job.nextRun());
            return false;
        } finally {
            MDC.remove("job");
        }
    }

    private JobOutcome invoke(Job job) {
        try {
            JobOutcome outcome = job.callback().run(job.args());
            return outcome == null ? JobOutcome.ok() : outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return JobOutcome.thrown(e);
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable e) {
            return JobOutcome.thrown(e);
        }
    }

    private void report(Job job, JobOutcome outcome) {
        if (outcome.cause() != null) {
            FAILURES.error("job={} kind={} error={}", job.name(), outcome.kind(), outcome.message(), outcome.cause());
        } else {
            FAILURES.error("job={} kind={} error={}", job.name(), outcome.kind(), outcome.message());
        }
        try {
            notifier.notify("[Job Error] " + job.name() + ": " + outcome.message());
        } catch (Throwable e) {
            LOG.warn("Failed to notify operator about job {}: {}", job.name(), e.getMessage());
        }
    }
}
