package io.avscheduler.cli;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

final class Timestamps {
    private static final DateTimeFormatter LOCAL = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern EPOCH_MILLIS = Pattern.compile("\\d+");
    private static final Pattern LOCAL_DATE_TIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}");

    private Timestamps() {
    }

    /**
     * Accepts epoch milliseconds, an ISO-8601 instant or offset date-time,
     * {@code yyyy-MM-dd HH:mm:ss} or {@code yyyy-MM-dd} (local to {@code zone}).
     */
    static Instant parse(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("timestamp must not be blank");
        }
        String value = raw.trim();
        try {
            if (EPOCH_MILLIS.matcher(value).matches()) {
                return Instant.ofEpochMilli(Long.parseLong(value));
            }
            if (value.indexOf('T') > 0) {
                return OffsetDateTime.parse(value).toInstant();
            }
            if (LOCAL_DATE_TIME.matcher(value).matches()) {
                return LocalDateTime.parse(value, LOCAL).atZone(zone).toInstant();
            }
            return LocalDate.parse(value).atStartOfDay(zone).toInstant();
        } catch (DateTimeException | NumberFormatException e) {
            throw new IllegalArgumentException("Unrecognized timestamp '" + raw + "'", e);
        }
    }
}
