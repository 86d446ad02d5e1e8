package io.herald.core.schedule;

/**
 * Invalid job registration input. Raised at setup time and never contained by the scheduler.
 */
public class ScheduleConfigException extends IllegalArgumentException {

    public ScheduleConfigException(String message) {
        super(message);
    }

    public ScheduleConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
