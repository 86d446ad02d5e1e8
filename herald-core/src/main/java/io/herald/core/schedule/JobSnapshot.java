package io.herald.core.schedule;

import java.time.Instant;
import java.util.List;

public record JobSnapshot(
    String name,
    String callback,
    List<String> args,
    String recurrence,
    Instant nextRun,
    Instant lastRun,
    String lastOutcome,
    long runs,
    long failures
) {
    static JobSnapshot of(JobHandle job) {
        return new JobSnapshot(
            job.name(),
            job.callbackName(),
            job.args(),
            job.recurrence().describe(),
            job.nextRun(),
            job.lastRun().orElse(null),
            job.lastOutcome().map(JobOutcome::describe).orElse(""),
            job.runs(),
            job.failures()
        );
    }
}
