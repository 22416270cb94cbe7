package io.avscheduler.config;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed configuration consumed by the scheduler core. Produced by {@link ConfigLoader}
 * or assembled directly.
 */
public final class SchedulerConfig {
    private final Settings settings;
    private final WebServerSettings webServer;
    private final Map<String, String> interpreters;
    private final Map<String, JobDefinition> jobs;

    public SchedulerConfig(
            Settings settings,
            WebServerSettings webServer,
            Map<String, String> interpreters,
            Map<String, JobDefinition> jobs
    ) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.webServer = webServer == null ? WebServerSettings.defaults() : webServer;
        this.interpreters = Collections.unmodifiableMap(new LinkedHashMap<>(interpreters == null ? Map.of() : interpreters));
        Map<String, JobDefinition> copy = new LinkedHashMap<>();
        if (jobs != null) {
            for (Map.Entry<String, JobDefinition> entry : jobs.entrySet()) {
                if (!entry.getKey().equals(entry.getValue().jobId())) {
                    throw new IllegalArgumentException(
                            "job key '" + entry.getKey() + "' does not match job id '" + entry.getValue().jobId() + "'"
                    );
                }
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        this.jobs = Collections.unmodifiableMap(copy);
    }

    public static SchedulerConfig of(Settings settings, Map<String, String> interpreters, Collection<JobDefinition> jobs) {
        Map<String, JobDefinition> byId = new LinkedHashMap<>();
        for (JobDefinition job : jobs) {
            if (byId.putIfAbsent(job.jobId(), job) != null) {
                throw new IllegalArgumentException("duplicate job id: " + job.jobId());
            }
        }
        return new SchedulerConfig(settings, WebServerSettings.defaults(), interpreters, byId);
    }

    public Settings settings() {
        return settings;
    }

    public WebServerSettings webServer() {
        return webServer;
    }

    public Map<String, String> interpreters() {
        return interpreters;
    }

    public Map<String, JobDefinition> jobs() {
        return jobs;
    }

    public Optional<JobDefinition> job(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public Optional<String> interpreterFor(JobDefinition job) {
        String path = job.type() == null ? null : interpreters.get(job.type());
        return path == null || path.isBlank() ? Optional.empty() : Optional.of(path);
    }
}
