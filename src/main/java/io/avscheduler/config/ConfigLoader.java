package io.avscheduler.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import io.avscheduler.exception.ConfigException;
import io.avscheduler.model.ScheduleType;
import io.avscheduler.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes the declarative configuration. TOML is the default format; files
 * ending in {@code .json} are read as JSON. Relative paths resolve against the
 * directory holding the configuration file.
 */
public final class ConfigLoader {
    private static final TomlMapper TOML = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    private static final ObjectMapper JSON = Jsons.mapper().copy()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ConfigLoader() {
    }

    public static SchedulerConfig load(Path file) {
        return toConfig(readDocument(file), baseDir(file));
    }

    public static ConfigDocument readDocument(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigException("Configuration file '" + file + "' not found.");
        }
        try {
            ConfigDocument doc = mapperFor(file).readValue(file.toFile(), ConfigDocument.class);
            return doc == null ? new ConfigDocument(null, null, null, null) : doc;
        } catch (IOException e) {
            throw new ConfigException("Failed to parse configuration file '" + file + "': " + e.getMessage(), e);
        }
    }

    public static void writeDocument(Path file, ConfigDocument document) {
        Path target = file.toAbsolutePath().normalize();
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapperFor(target).writeValue(tmp.toFile(), document);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ConfigException("Failed to write configuration file '" + file + "'", e);
        }
    }

    public static SchedulerConfig toConfig(ConfigDocument doc, Path baseDir) {
        ConfigDocument.SettingsSection s = doc.settings() == null
                ? new ConfigDocument.SettingsSection(null, null, null, null, null, null)
                : doc.settings();
        Path dbPath = resolve(baseDir, s.dbPath() == null || s.dbPath().isBlank() ? Settings.DEFAULT_DB_FILE : s.dbPath());
        Settings settings = new Settings(
                dbPath,
                s.pidFile() == null || s.pidFile().isBlank() ? null : resolve(baseDir, s.pidFile()),
                s.logFile() == null || s.logFile().isBlank() ? null : resolve(baseDir, s.logFile()),
                parseZone(s.timezone()),
                s.tickMillis() == null ? Settings.DEFAULT_TICK_MILLIS : s.tickMillis(),
                s.shutdownGraceSeconds() == null ? Settings.DEFAULT_SHUTDOWN_GRACE_SECONDS : s.shutdownGraceSeconds()
        );

        WebServerSettings web;
        try {
            web = doc.webServer() == null
                    ? WebServerSettings.defaults()
                    : new WebServerSettings(
                    doc.webServer().host(),
                    doc.webServer().port() == null ? WebServerSettings.DEFAULT_PORT : doc.webServer().port()
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }

        Map<String, JobDefinition> jobs = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigDocument.JobSection> entry : doc.jobs().entrySet()) {
            jobs.put(entry.getKey(), toJob(entry.getKey(), entry.getValue(), baseDir));
        }
        return new SchedulerConfig(settings, web, doc.interpreters(), jobs);
    }

    static JobDefinition toJob(String jobId, ConfigDocument.JobSection section, Path baseDir) {
        if (jobId == null || jobId.isBlank()) {
            throw new ConfigException("job id must not be blank");
        }
        if (section == null) {
            throw new ConfigException("job '" + jobId + "' has no definition");
        }
        if (section.type() == null || section.type().isBlank()) {
            throw new ConfigException("job '" + jobId + "' is missing 'type'");
        }
        if (section.command() == null || section.command().isBlank()) {
            throw new ConfigException("job '" + jobId + "' is missing 'command'");
        }
        ScheduleType scheduleType;
        boolean typeOmitted = section.scheduleType() == null || section.scheduleType().isBlank();
        if (typeOmitted && section.schedule() == null && section.intervalSeconds() != null) {
            scheduleType = ScheduleType.INTERVAL;
        } else {
            try {
                scheduleType = ScheduleType.fromString(section.scheduleType());
            } catch (IllegalArgumentException e) {
                throw new ConfigException("job '" + jobId + "': " + e.getMessage(), e);
            }
        }
        String envFile = section.envFile() == null || section.envFile().isBlank()
                ? null
                : resolve(baseDir, section.envFile()).toString();
        return new JobDefinition(
                jobId,
                section.type().trim(),
                scheduleType,
                section.schedule(),
                section.intervalSeconds(),
                section.command(),
                section.condition(),
                envFile,
                section.name(),
                section.timeoutSeconds() == null ? 0L : section.timeoutSeconds()
        );
    }

    private static ZoneId parseZone(String raw) {
        if (raw == null || raw.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            throw new ConfigException("Unknown settings.timezone: " + raw, e);
        }
    }

    private static Path resolve(Path baseDir, String raw) {
        Path p = Path.of(raw.trim());
        if (p.isAbsolute() || baseDir == null) {
            return p.toAbsolutePath().normalize();
        }
        return baseDir.resolve(p).normalize();
    }

    static Path baseDir(Path file) {
        Path parent = file.toAbsolutePath().normalize().getParent();
        return parent == null ? Path.of("").toAbsolutePath() : parent;
    }

    private static ObjectMapper mapperFor(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") ? JSON : TOML;
    }
}
