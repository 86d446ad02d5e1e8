package io.herald.core.schedule;

import io.herald.core.config.model.JobConfig;
import java.util.ArrayList;
import java.util.List;

/**
 * Expands configured job entries into {@link JobSpec}s: one daily job per {@code at} time, plus one
 * interval job when {@code everyMinutes} is set.
 */
public final class JobPlanner {
    private final CallbackRegistry callbacks;

    public JobPlanner(CallbackRegistry callbacks) {
        this.callbacks = callbacks;
    }

    public List<JobSpec> plan(List<JobConfig> entries) {
        List<JobSpec> specs = new ArrayList<>();
        if (entries == null) {
            return specs;
        }
        for (JobConfig entry : entries) {
            specs.addAll(plan(entry));
        }
        return specs;
    }

    public List<JobSpec> plan(JobConfig entry) {
        if (entry == null || entry.name() == null || entry.name().isBlank()) {
            throw new ScheduleConfigException("job entry requires a name");
        }
        String callbackName = entry.callback() == null || entry.callback().isBlank() ? entry.name() : entry.callback();
        JobCallback callback = callbacks.find(callbackName)
            .orElseThrow(() -> new ScheduleConfigException(
                "job '" + entry.name() + "' references unknown callback '" + callbackName + "', known: " + callbacks.names()
            ));

        boolean hasTimes = !entry.at().isEmpty();
        boolean hasInterval = entry.everyMinutes() != null;
        if (!hasTimes && !hasInterval) {
            throw new ScheduleConfigException("job '" + entry.name() + "' needs 'at' times or 'everyMinutes'");
        }

        List<JobSpec> specs = new ArrayList<>();
        for (String time : entry.at()) {
            Recurrence.Daily daily = Recurrence.dailyAt(time);
            specs.add(new JobSpec(entry.name() + "@" + daily.timeOfDay(), callbackName, callback, entry.args(), daily));
        }
        if (hasInterval) {
            specs.add(new JobSpec(entry.name(), callbackName, callback, entry.args(), Recurrence.everyMinutes(entry.everyMinutes())));
        }
        return specs;
    }
}
