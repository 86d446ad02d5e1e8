package io.herald.core.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingNotifier implements FailureNotifier {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(String text) {
        LOG.warn("Operator alert: {}", text);
    }
}
