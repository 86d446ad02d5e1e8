package io.herald.core.publish;

/**
 * Sends one composed message to the outside world. Implementations report failures through
 * {@link PublishResult#failed(PublishError)} rather than throwing.
 */
public interface Publisher {

    String name();

    PublishResult publish(String message);
}
