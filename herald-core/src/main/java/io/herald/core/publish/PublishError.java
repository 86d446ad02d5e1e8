package io.herald.core.publish;

public record PublishError(int status, String message) {

    public static PublishError transport(String message) {
        return new PublishError(0, message);
    }

    public String describe() {
        return status > 0 ? "HTTP " + status + ": " + message : message;
    }
}
