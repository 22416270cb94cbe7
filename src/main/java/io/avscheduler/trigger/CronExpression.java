package io.avscheduler.trigger;

import io.avscheduler.exception.InvalidScheduleException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>Each field accepts {@code *}, single values, {@code a-b} ranges, comma lists and
 * {@code /step} suffixes. Months accept {@code JAN-DEC}, weekdays accept {@code SUN-SAT}
 * and both 0 and 7 mean Sunday.
 *
 * <p>Day matching follows Vixie cron: a day field counts as restricted unless its token
 * starts with {@code *}. When both day-of-month and day-of-week are restricted a day
 * matches if either one matches, otherwise both must match.
 */
public final class CronExpression {
    private static final int SEARCH_YEARS = 8;
    private static final String[] MONTH_NAMES = {
            "JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"
    };
    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};

    private final String expression;
    private final Field minutes;
    private final Field hours;
    private final Field daysOfMonth;
    private final Field months;
    private final Field daysOfWeek;

    private CronExpression(String expression, Field minutes, Field hours, Field daysOfMonth, Field months, Field daysOfWeek) {
        this.expression = expression;
        this.minutes = minutes;
        this.hours = hours;
        this.daysOfMonth = daysOfMonth;
        this.months = months;
        this.daysOfWeek = daysOfWeek;
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("cron expression must not be blank");
        }
        String normalized = expression.trim();
        String[] parts = normalized.split("\\s+");
        if (parts.length != 5) {
            throw new InvalidScheduleException(
                    "cron expression must have 5 fields (minute hour day-of-month month day-of-week), got "
                            + parts.length + ": '" + normalized + "'"
            );
        }
        return new CronExpression(
                String.join(" ", parts),
                Field.parse("minute", parts[0], 0, 59, null, 0),
                Field.parse("hour", parts[1], 0, 23, null, 0),
                Field.parse("day-of-month", parts[2], 1, 31, null, 0),
                Field.parse("month", parts[3], 1, 12, MONTH_NAMES, 1),
                Field.parse("day-of-week", parts[4], 0, 7, DAY_NAMES, 0)
        );
    }

    /**
     * Earliest minute-aligned instant strictly after {@code after} that satisfies every field,
     * with fields interpreted as wall-clock time in {@code zone}.
     */
    public Instant next(Instant after, ZoneId zone) {
        LocalDateTime t = LocalDateTime.ofInstant(after, zone).truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDateTime limit = t.plusYears(SEARCH_YEARS);
        while (t.isBefore(limit)) {
            if (!months.matches(t.getMonthValue())) {
                t = t.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!dayMatches(t.toLocalDate())) {
                t = t.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!hours.matches(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.matches(t.getMinute())) {
                t = t.plusMinutes(1);
                continue;
            }
            // Local times inside a DST overlap may map before 'after'.
            Instant candidate = t.atZone(zone).toInstant();
            if (candidate.isAfter(after)) {
                return candidate;
            }
            t = t.plusMinutes(1);
        }
        throw new InvalidScheduleException("cron expression never fires: '" + expression + "'");
    }

    public boolean matches(LocalDateTime time) {
        return minutes.matches(time.getMinute())
                && hours.matches(time.getHour())
                && months.matches(time.getMonthValue())
                && dayMatches(time.toLocalDate());
    }

    private boolean dayMatches(LocalDate date) {
        boolean domMatch = daysOfMonth.matches(date.getDayOfMonth());
        boolean dowMatch = daysOfWeek.matches(date.getDayOfWeek().getValue() % 7);
        if (daysOfMonth.unrestricted() || daysOfWeek.unrestricted()) {
            return domMatch && dowMatch;
        }
        return domMatch || dowMatch;
    }

    public String expression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CronExpression other)) {
            return false;
        }
        return expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }

    private record Field(boolean unrestricted, long bits) {
        static Field parse(String name, String token, int min, int max, String[] names, int nameOffset) {
            long bits = 0L;
            for (String part : token.split(",", -1)) {
                if (part.isEmpty()) {
                    throw new InvalidScheduleException("empty list element in " + name + " field: '" + token + "'");
                }
                bits |= parsePart(name, part, min, max, names, nameOffset);
            }
            if (max == 7 && (bits & (1L << 7)) != 0) {
                bits = (bits & ~(1L << 7)) | 1L;
            }
            return new Field(token.startsWith("*"), bits);
        }

        private static long parsePart(String name, String part, int min, int max, String[] names, int nameOffset) {
            String[] stepSplit = part.split("/", -1);
            if (stepSplit.length > 2) {
                throw new InvalidScheduleException("invalid step in " + name + " field: '" + part + "'");
            }
            String range = stepSplit[0];
            int step = 1;
            if (stepSplit.length == 2) {
                step = parseNumber(name, stepSplit[1], part);
                if (step <= 0) {
                    throw new InvalidScheduleException("step must be positive in " + name + " field: '" + part + "'");
                }
            }
            int start;
            int end;
            if ("*".equals(range)) {
                start = min;
                end = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw new InvalidScheduleException("invalid range in " + name + " field: '" + part + "'");
                }
                start = resolve(name, bounds[0], min, max, names, nameOffset);
                end = resolve(name, bounds[1], min, max, names, nameOffset);
                if (start > end) {
                    throw new InvalidScheduleException("inverted range in " + name + " field: '" + part + "'");
                }
            } else {
                start = resolve(name, range, min, max, names, nameOffset);
                end = stepSplit.length == 2 ? max : start;
            }
            long bits = 0L;
            for (int v = start; v <= end; v += step) {
                bits |= 1L << v;
            }
            return bits;
        }

        private static int resolve(String name, String raw, int min, int max, String[] names, int nameOffset) {
            if (names != null) {
                String upper = raw.toUpperCase(Locale.ROOT);
                for (int i = 0; i < names.length; i++) {
                    if (names[i].equals(upper)) {
                        return i + nameOffset;
                    }
                }
            }
            int value = parseNumber(name, raw, raw);
            if (value < min || value > max) {
                throw new InvalidScheduleException(
                        name + " value " + value + " out of range " + min + "-" + max
                );
            }
            return value;
        }

        private static int parseNumber(String name, String raw, String context) {
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new InvalidScheduleException("invalid " + name + " value '" + context + "'", e);
            }
        }

        boolean matches(int value) {
            return (bits & (1L << value)) != 0;
        }
    }
}
