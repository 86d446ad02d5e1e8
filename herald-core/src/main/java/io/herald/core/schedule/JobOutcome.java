package io.herald.core.schedule;

/**
 * Result of one job execution. Callbacks return it; the scheduler also builds a {@link FailureKind#CALLBACK}
 * outcome for any exception a callback throws, so rescheduling is decided from data only.
 */
public record JobOutcome(boolean success, FailureKind kind, String message, Throwable cause) {

    private static final JobOutcome SUCCESS = new JobOutcome(true, null, "", null);

    public JobOutcome {
        message = message == null ? "" : message;
        if (!success && kind == null) {
            kind = FailureKind.CALLBACK;
        }
    }

    public static JobOutcome ok() {
        return SUCCESS;
    }

    public static JobOutcome failure(FailureKind kind, String message) {
        return new JobOutcome(false, kind, message, null);
    }

    public static JobOutcome failure(FailureKind kind, String message, Throwable cause) {
        return new JobOutcome(false, kind, message, cause);
    }

    public static JobOutcome thrown(Throwable error) {
        String detail = error.getMessage() == null || error.getMessage().isBlank()
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + error.getMessage();
        return new JobOutcome(false, FailureKind.CALLBACK, detail, error);
    }

    public String describe() {
        if (success) {
            return "ok";
        }
        return kind.name().toLowerCase() + ": " + message;
    }
}
