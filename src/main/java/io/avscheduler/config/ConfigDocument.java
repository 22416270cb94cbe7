package io.avscheduler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration file contents exactly as written, before paths are resolved. Job
 * mutations edit this form so a rewrite keeps the user's relative paths.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfigDocument(
        SettingsSection settings,
        @JsonProperty("web_server") WebServerSection webServer,
        Map<String, String> interpreters,
        Map<String, JobSection> jobs
) {
    public ConfigDocument {
        interpreters = interpreters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(interpreters);
        jobs = jobs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(jobs);
    }

    public ConfigDocument withJobs(Map<String, JobSection> newJobs) {
        return new ConfigDocument(settings, webServer, interpreters, newJobs);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SettingsSection(
            @JsonProperty("db_path") String dbPath,
            @JsonProperty("pid_file") String pidFile,
            @JsonProperty("log_file") String logFile,
            String timezone,
            @JsonProperty("tick_millis") Long tickMillis,
            @JsonProperty("shutdown_grace_seconds") Long shutdownGraceSeconds
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record WebServerSection(String host, Integer port) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record JobSection(
            String type,
            String schedule,
            @JsonProperty("schedule_type") String scheduleType,
            @JsonProperty("interval_seconds") Long intervalSeconds,
            String command,
            String condition,
            @JsonProperty("env_file") String envFile,
            String name,
            @JsonProperty("timeout_seconds") Long timeoutSeconds
    ) {
        public JobSection merge(JobSection patch) {
            return new JobSection(
                    patch.type() != null ? patch.type() : type,
                    patch.schedule() != null ? patch.schedule() : schedule,
                    patch.scheduleType() != null ? patch.scheduleType() : scheduleType,
                    patch.intervalSeconds() != null ? patch.intervalSeconds() : intervalSeconds,
                    patch.command() != null ? patch.command() : command,
                    patch.condition() != null ? patch.condition() : condition,
                    patch.envFile() != null ? patch.envFile() : envFile,
                    patch.name() != null ? patch.name() : name,
                    patch.timeoutSeconds() != null ? patch.timeoutSeconds() : timeoutSeconds
            );
        }
    }
}
