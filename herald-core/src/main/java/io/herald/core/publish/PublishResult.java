package io.herald.core.publish;

import java.util.Optional;

public record PublishResult(boolean ok, String id, PublishError error) {

    public static PublishResult published(String id) {
        return new PublishResult(true, id == null ? "" : id, null);
    }

    public static PublishResult failed(PublishError error) {
        return new PublishResult(false, "", error);
    }

    public Optional<PublishError> failure() {
        return Optional.ofNullable(error);
    }
}
