package io.avscheduler.model;

import java.util.Locale;

public enum ScheduleType {
    CRON("cron"),
    INTERVAL("interval");

    private final String configName;

    ScheduleType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static ScheduleType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return CRON;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ScheduleType value : values()) {
            if (value.configName.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown schedule_type: " + raw);
    }
}
