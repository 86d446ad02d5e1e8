package io.herald.core.publish;

import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DryRunPublisher implements Publisher {
    private static final Logger LOG = LoggerFactory.getLogger(DryRunPublisher.class);

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String name() {
        return "dry-run";
    }

    @Override
    public PublishResult publish(String message) {
        String id = "dry-run-" + sequence.incrementAndGet();
        LOG.info("Dry run publish {}: {}", id, message);
        return PublishResult.published(id);
    }
}
