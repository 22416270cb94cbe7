package io.avscheduler.config;

import io.avscheduler.exception.ConfigException;
import io.avscheduler.exception.JobNotFoundException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Adds, edits and deletes job entries in a configuration file. Every change is validated
 * against the whole resulting configuration before the file is rewritten; a running
 * daemon picks the change up through its hot reload.
 */
public final class JobConfigEditor {
    private JobConfigEditor() {
    }

    public static JobMutation addJob(Path file, String jobId, ConfigDocument.JobSection section) {
        ConfigDocument doc = Files.exists(file)
                ? ConfigLoader.readDocument(file)
                : new ConfigDocument(null, null, null, null);
        if (doc.jobs().containsKey(jobId)) {
            throw new ConfigException("Job '" + jobId + "' already exists");
        }
        Map<String, ConfigDocument.JobSection> jobs = new LinkedHashMap<>(doc.jobs());
        jobs.put(jobId, section);
        return commit(file, doc.withJobs(jobs), "added", jobId);
    }

    /** Fields left {@code null} in {@code patch} keep their current value. */
    public static JobMutation editJob(Path file, String jobId, ConfigDocument.JobSection patch) {
        ConfigDocument doc = ConfigLoader.readDocument(file);
        ConfigDocument.JobSection current = doc.jobs().get(jobId);
        if (current == null) {
            throw new JobNotFoundException(jobId);
        }
        Map<String, ConfigDocument.JobSection> jobs = new LinkedHashMap<>(doc.jobs());
        jobs.put(jobId, current.merge(patch));
        return commit(file, doc.withJobs(jobs), "updated", jobId);
    }

    public static JobMutation deleteJob(Path file, String jobId) {
        ConfigDocument doc = ConfigLoader.readDocument(file);
        if (!doc.jobs().containsKey(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        Map<String, ConfigDocument.JobSection> jobs = new LinkedHashMap<>(doc.jobs());
        jobs.remove(jobId);
        return commit(file, doc.withJobs(jobs), "deleted", jobId);
    }

    private static JobMutation commit(Path file, ConfigDocument doc, String action, String jobId) {
        SchedulerConfig validated = ConfigLoader.toConfig(doc, ConfigLoader.baseDir(file));
        validated.job(jobId).ifPresent(JobDefinition::scheduleSpec);
        ConfigLoader.writeDocument(file, doc);
        return new JobMutation(action, jobId, file.toAbsolutePath().normalize().toString(), validated.jobs().size());
    }

    public record JobMutation(String action, String jobId, String configFile, int jobCount) {
    }
}
