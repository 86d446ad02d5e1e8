package io.herald.core.schedule;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * When a job re-triggers: once a day at a fixed local time, or after a fixed interval.
 */
public sealed interface Recurrence permits Recurrence.Daily, Recurrence.Interval {

    /**
     * Computes the next run strictly after {@code after}.
     */
    Instant next(Instant after, ZoneId zone);

    String describe();

    static Daily dailyAt(String timeOfDay) {
        return Daily.parse(timeOfDay);
    }

    static Interval everyMinutes(int minutes) {
        if (minutes <= 0) {
            throw new ScheduleConfigException("interval minutes must be > 0, got " + minutes);
        }
        return new Interval(Duration.ofMinutes(minutes));
    }

    record Daily(LocalTime timeOfDay) implements Recurrence {
        private static final Pattern HH_MM = Pattern.compile("^(\\d{2}):(\\d{2})$");

        public Daily {
            if (timeOfDay == null) {
                throw new ScheduleConfigException("time of day is required");
            }
            timeOfDay = timeOfDay.withSecond(0).withNano(0);
        }

        static Daily parse(String raw) {
            if (raw == null) {
                throw new ScheduleConfigException("time of day is required (HH:mm)");
            }
            Matcher matcher = HH_MM.matcher(raw.trim());
            if (!matcher.matches()) {
                throw new ScheduleConfigException("invalid time of day '" + raw + "', expected HH:mm");
            }
            try {
                return new Daily(LocalTime.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
            } catch (DateTimeException e) {
                throw new ScheduleConfigException("invalid time of day '" + raw + "', expected HH:mm", e);
            }
        }

        @Override
        public Instant next(Instant after, ZoneId zone) {
            Objects.requireNonNull(after, "after must not be null");
            LocalDate day = after.atZone(zone).toLocalDate();
            Instant candidate = ZonedDateTime.of(day, timeOfDay, zone).toInstant();
            if (!candidate.isAfter(after)) {
                candidate = ZonedDateTime.of(day.plusDays(1), timeOfDay, zone).toInstant();
            }
            return candidate;
        }

        @Override
        public String describe() {
            return "daily at " + timeOfDay;
        }
    }

    record Interval(Duration every) implements Recurrence {
        public Interval {
            if (every == null || every.isZero() || every.isNegative()) {
                throw new ScheduleConfigException("interval must be positive");
            }
        }

        @Override
        public Instant next(Instant after, ZoneId zone) {
            Objects.requireNonNull(after, "after must not be null");
            return after.plus(every);
        }

        @Override
        public String describe() {
            return "every " + every.toMinutes() + " min";
        }
    }
}
