package io.herald.core.callback;

import io.herald.core.schedule.JobCallback;
import io.herald.core.schedule.JobOutcome;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HeartbeatCallback implements JobCallback {
    public static final String NAME = "heartbeat";

    private static final Logger LOG = LoggerFactory.getLogger(HeartbeatCallback.class);

    private final Clock clock;
    private final AtomicLong beats = new AtomicLong();

    public HeartbeatCallback(Clock clock) {
        this.clock = clock;
    }

    @Override
    public JobOutcome run(List<String> args) {
        long beat = beats.incrementAndGet();
        LOG.info("Heartbeat #{} at {}", beat, clock.instant());
        return JobOutcome.ok();
    }

    public long beats() {
        return beats.get();
    }
}
