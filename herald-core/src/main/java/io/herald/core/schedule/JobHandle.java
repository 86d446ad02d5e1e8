package io.herald.core.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a registered job. State changes are made by {@link SafeScheduler} only.
 */
public interface JobHandle {
    String name();

    String callbackName();

    List<String> args();

    Recurrence recurrence();

    Instant nextRun();

    Optional<Instant> lastRun();

    Optional<JobOutcome> lastOutcome();

    long runs();

    long failures();
}
