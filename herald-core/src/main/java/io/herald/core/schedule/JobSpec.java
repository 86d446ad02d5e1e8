package io.herald.core.schedule;

import java.util.List;

public record JobSpec(String name, String callbackName, JobCallback callback, List<String> args, Recurrence recurrence) {

    public JobSpec {
        if (name == null || name.isBlank()) {
            throw new ScheduleConfigException("job name is required");
        }
        if (callback == null) {
            throw new ScheduleConfigException("job '" + name + "' has no callback");
        }
        if (recurrence == null) {
            throw new ScheduleConfigException("job '" + name + "' has no recurrence");
        }
        name = name.trim();
        callbackName = callbackName == null || callbackName.isBlank() ? name : callbackName.trim();
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static JobSpec of(String name, JobCallback callback, Recurrence recurrence) {
        return new JobSpec(name, name, callback, List.of(), recurrence);
    }
}
