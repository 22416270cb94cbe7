package io.avscheduler.trigger;

import io.avscheduler.exception.InvalidScheduleException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Computes next fire times. Stateless apart from the zone cron fields are read in.
 */
public final class TriggerEngine {
    private final ZoneId zone;

    public TriggerEngine(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * @throws InvalidScheduleException when the schedule never fires again or its next
     *                                  fire time lies outside the representable range
     */
    public Instant nextFireTime(ScheduleSpec spec, Instant after) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(after, "after");
        try {
            return spec.nextAfter(after, zone);
        } catch (ArithmeticException | DateTimeException e) {
            throw new InvalidScheduleException(
                    "Schedule " + spec.describe() + " has no representable fire time after " + after, e
            );
        }
    }
}
