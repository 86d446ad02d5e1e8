package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(boolean rescheduleOnFailure, int pollIntervalSeconds, String zone) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(true, 1, "");
    }

    @JsonIgnore
    public Duration pollInterval() {
        return Duration.ofSeconds(Math.max(1, pollIntervalSeconds));
    }

    @JsonIgnore
    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone.trim());
    }
}
