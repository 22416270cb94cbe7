package io.avscheduler.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Objects;

public record Settings(
        Path dbPath,
        Path pidFile,
        Path logFile,
        ZoneId timezone,
        long tickMillis,
        long shutdownGraceSeconds
) {
    public static final String DEFAULT_DB_FILE = "jobs.db";
    public static final String DEFAULT_PID_FILE = "avscheduler.pid";
    public static final long DEFAULT_TICK_MILLIS = 500L;
    public static final long DEFAULT_SHUTDOWN_GRACE_SECONDS = 30L;

    public Settings {
        Objects.requireNonNull(dbPath, "dbPath");
        pidFile = pidFile == null ? defaultPidFile() : pidFile;
        logFile = logFile == null ? defaultLogFile(dbPath) : logFile;
        timezone = timezone == null ? ZoneId.systemDefault() : timezone;
        tickMillis = tickMillis <= 0 ? DEFAULT_TICK_MILLIS : Math.max(10L, tickMillis);
        shutdownGraceSeconds = Math.max(0L, shutdownGraceSeconds);
    }

    public static Settings forDatabase(Path dbPath) {
        return new Settings(dbPath, null, null, null, DEFAULT_TICK_MILLIS, DEFAULT_SHUTDOWN_GRACE_SECONDS);
    }

    public Settings withTimezone(ZoneId newTimezone) {
        return new Settings(dbPath, pidFile, logFile, newTimezone, tickMillis, shutdownGraceSeconds);
    }

    static Path defaultPidFile() {
        return Paths.get(System.getProperty("java.io.tmpdir", "/tmp")).resolve(DEFAULT_PID_FILE);
    }

    static Path defaultLogFile(Path dbPath) {
        Path parent = dbPath.toAbsolutePath().normalize().getParent();
        Path base = parent == null ? Paths.get(".") : parent;
        return base.resolve("logs").resolve("executions.log");
    }
}
