package io.herald.core.schedule;

import java.time.Instant;

/**
 * Decides where a failed job's next run goes.
 */
@FunctionalInterface
public interface ReschedulePolicy {

    /**
     * @param job the job that just failed, still holding its pre-attempt {@code nextRun}
     * @param attemptedAt when the failed attempt ran
     * @param advancedRun the next run a successful attempt at {@code attemptedAt} would get
     */
    Instant nextRunAfterFailure(JobHandle job, Instant attemptedAt, Instant advancedRun);

    /** Failed runs are rescheduled as if they had succeeded, so a broken job cannot busy-loop. */
    static ReschedulePolicy advance() {
        return (job, attemptedAt, advancedRun) -> advancedRun;
    }

    /** Failed runs keep their due time and are attempted again on the next poll. */
    static ReschedulePolicy retryOnNextPoll() {
        return (job, attemptedAt, advancedRun) -> job.nextRun();
    }

    static ReschedulePolicy of(boolean rescheduleOnFailure) {
        return rescheduleOnFailure ? advance() : retryOnNextPoll();
    }
}
