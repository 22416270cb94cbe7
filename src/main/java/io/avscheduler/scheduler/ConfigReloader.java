package io.avscheduler.scheduler;

import io.avscheduler.config.ConfigLoader;
import io.avscheduler.config.SchedulerConfig;
import io.avscheduler.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reloads the scheduler when the configuration file's modification time changes.
 * A file that fails to parse is reported and the running configuration is kept.
 */
public final class ConfigReloader {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigReloader.class);

    private final Path configFile;
    private final SchedulerCore core;
    private long lastMtimeMs;

    public ConfigReloader(Path configFile, SchedulerCore core) {
        this.configFile = configFile;
        this.core = core;
        this.lastMtimeMs = mtimeMs(configFile);
    }

    public synchronized Optional<ReloadOutcome> maybeReload() {
        long mtime = mtimeMs(configFile);
        if (mtime < 0L || mtime == lastMtimeMs) {
            return Optional.empty();
        }
        lastMtimeMs = mtime;
        SchedulerConfig loaded;
        try {
            loaded = ConfigLoader.load(configFile);
        } catch (ConfigException e) {
            LOG.warn("Configuration {} changed but is invalid, keeping current jobs: {}", configFile, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(core.reload(loaded));
    }

    static long mtimeMs(Path file) {
        try {
            return Files.exists(file) ? Files.getLastModifiedTime(file).toMillis() : -1L;
        } catch (IOException e) {
            LOG.debug("Cannot read modification time of {}: {}", file, e.getMessage());
            return -1L;
        }
    }
}
