package io.herald.core.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

final class Job implements JobHandle {
    private final JobSpec spec;
    private Instant nextRun;
    private Instant lastRun;
    private JobOutcome lastOutcome;
    private long runs;
    private long failures;

    Job(JobSpec spec, Instant nextRun) {
        this.spec = spec;
        this.nextRun = nextRun;
    }

    JobCallback callback() {
        return spec.callback();
    }

    synchronized void attempted(Instant at, Instant next, JobOutcome outcome) {
        this.lastRun = at;
        this.nextRun = next;
        this.lastOutcome = outcome;
        this.runs++;
        if (!outcome.success()) {
            this.failures++;
        }
    }

    synchronized boolean isDue(Instant now) {
        return !nextRun.isAfter(now);
    }

    @Override
    public String name() {
        return spec.name();
    }

    @Override
    public String callbackName() {
        return spec.callbackName();
    }

    @Override
    public List<String> args() {
        return spec.args();
    }

    @Override
    public Recurrence recurrence() {
        return spec.recurrence();
    }

    @Override
    public synchronized Instant nextRun() {
        return nextRun;
    }

    @Override
    public synchronized Optional<Instant> lastRun() {
        return Optional.ofNullable(lastRun);
    }

    @Override
    public synchronized Optional<JobOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    @Override
    public synchronized long runs() {
        return runs;
    }

    @Override
    public synchronized long failures() {
        return failures;
    }

    @Override
    public String toString() {
        return "Job[" + spec.name() + ", " + spec.recurrence().describe() + ", next=" + nextRun + "]";
    }
}
