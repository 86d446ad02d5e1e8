package io.herald.core.notify;

import java.io.IOException;

/**
 * Operator alert channel used when a scheduled job fails.
 */
@FunctionalInterface
public interface FailureNotifier {
    void notify(String text) throws IOException;
}
