package io.avscheduler.trigger;

import io.avscheduler.exception.InvalidScheduleException;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * When a job fires: either a cron expression or a fixed interval.
 */
public sealed interface ScheduleSpec permits ScheduleSpec.CronSchedule, ScheduleSpec.IntervalSchedule {

    String describe();

    /** First fire time strictly after {@code after}; cron fields are read in {@code zone}. */
    Instant nextAfter(Instant after, ZoneId zone);

    static ScheduleSpec cron(String expression) {
        return new CronSchedule(CronExpression.parse(expression));
    }

    static ScheduleSpec interval(long seconds) {
        if (seconds <= 0) {
            throw new InvalidScheduleException("interval_seconds must be positive, got " + seconds);
        }
        return new IntervalSchedule(Duration.ofSeconds(seconds));
    }

    record CronSchedule(CronExpression expression) implements ScheduleSpec {
        public CronSchedule {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public String describe() {
            return "cron(" + expression.expression() + ")";
        }

        @Override
        public Instant nextAfter(Instant after, ZoneId zone) {
            return expression.next(after, zone);
        }
    }

    record IntervalSchedule(Duration interval) implements ScheduleSpec {
        public IntervalSchedule {
            Objects.requireNonNull(interval, "interval");
        }

        @Override
        public String describe() {
            return "interval(" + interval.toSeconds() + "s)";
        }

        @Override
        public Instant nextAfter(Instant after, ZoneId zone) {
            return after.plus(interval);
        }
    }
}
