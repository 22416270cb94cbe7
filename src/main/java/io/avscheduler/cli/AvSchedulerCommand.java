package io.avscheduler.cli;

import io.avscheduler.config.ConfigDocument;
import io.avscheduler.config.ConfigLoader;
import io.avscheduler.config.JobConfigEditor;
import io.avscheduler.config.SchedulerConfig;
import io.avscheduler.exception.SchedulerException;
import io.avscheduler.model.ExecutionRecord;
import io.avscheduler.model.JobStatusView;
import io.avscheduler.model.RunStatus;
import io.avscheduler.scheduler.ConfigReloader;
import io.avscheduler.scheduler.RunOutcome;
import io.avscheduler.scheduler.SchedulerCore;
import io.avscheduler.storage.Database;
import io.avscheduler.storage.ExecutionLogStore;
import io.avscheduler.util.Jsons;
import io.avscheduler.web.StatusServer;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "avscheduler",
        mixinStandardHelpOptions = true,
        description = "Single-host cron and interval job scheduler",
        subcommands = {
                AvSchedulerCommand.StartCommand.class,
                AvSchedulerCommand.StopCommand.class,
                AvSchedulerCommand.RestartCommand.class,
                AvSchedulerCommand.StatusCommand.class,
                AvSchedulerCommand.ListJobsCommand.class,
                AvSchedulerCommand.RunJobCommand.class,
                AvSchedulerCommand.ViewLogsCommand.class,
                AvSchedulerCommand.CleanupLogsCommand.class,
                AvSchedulerCommand.AddJobCommand.class,
                AvSchedulerCommand.EditJobCommand.class,
                AvSchedulerCommand.DeleteJobCommand.class,
                AvSchedulerCommand.ReloadConfigCommand.class,
                AvSchedulerCommand.ServeWebCommand.class
        }
)
public final class AvSchedulerCommand implements Runnable {

    @Option(names = {"-c", "--config"}, description = "Configuration file (TOML, or JSON by extension)",
            defaultValue = "config.toml")
    String config;

    @Override
    public void run() {
        System.out.println("Use subcommands: start | stop | restart | status | list-jobs | run-job | view-logs | cleanup-logs | add-job | edit-job | delete-job | reload-config | serve-web");
    }

    Path configPath() {
        return Path.of(config).toAbsolutePath().normalize();
    }

    SchedulerConfig loadConfig() {
        return ConfigLoader.load(configPath());
    }

    SchedulerCore core() {
        return SchedulerCore.create(loadConfig());
    }

    static int fail(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        System.out.println(Jsons.toJson(body));
        return 1;
    }

    @Command(name = "start", description = "Run the scheduler in the foreground until terminated")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Option(names = {"--reload-interval-ms"}, defaultValue = "2000",
                description = "How often to check the configuration file for changes")
        long reloadIntervalMs;

        @Override
        public Integer call() {
            return runDaemon(parent, reloadIntervalMs);
        }
    }

    @Command(name = "stop", description = "Send SIGTERM to the running scheduler")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Option(names = {"--wait-seconds"}, defaultValue = "60", description = "How long to wait for the process to exit")
        long waitSeconds;

        @Override
        public Integer call() throws Exception {
            StopOutcome outcome = stopDaemon(new PidFile(parent.loadConfig().settings().pidFile()), waitSeconds);
            System.out.println(Jsons.toJson(outcome));
            return outcome.stopped() ? 0 : 1;
        }
    }

    @Command(name = "restart", description = "Stop the running scheduler, then run it in the foreground")
    static final class RestartCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Option(names = {"--wait-seconds"}, defaultValue = "60", description = "How long to wait for the old process to exit")
        long waitSeconds;

        @Option(names = {"--reload-interval-ms"}, defaultValue = "2000",
                description = "How often to check the configuration file for changes")
        long reloadIntervalMs;

        @Override
        public Integer call() throws Exception {
            SchedulerConfig config;
            try {
                config = parent.loadConfig();
            } catch (SchedulerException e) {
                return fail("invalid_config", e.getMessage());
            }
            StopOutcome stop = stopDaemon(new PidFile(config.settings().pidFile()), waitSeconds);
            System.out.println(Jsons.toJson(stop));
            if (stop.pid() != null && !stop.stopped()) {
                return fail("restart_failed", "Previous scheduler (PID " + stop.pid() + ") did not exit");
            }
            return runDaemon(parent, reloadIntervalMs);
        }
    }

    /**
     * Foreground daemon loop: writes the PID file, polls the configuration for changes and
     * returns when the JVM shuts down or the calling thread is interrupted.
     */
    static int runDaemon(AvSchedulerCommand parent, long reloadIntervalMs) {
        SchedulerConfig config;
        try {
            config = parent.loadConfig();
        } catch (SchedulerException e) {
            return fail("invalid_config", e.getMessage());
        }
        PidFile pidFile = new PidFile(config.settings().pidFile());
        Optional<ProcessHandle> existing = pidFile.liveProcess();
        if (existing.isPresent() && existing.get().pid() != ProcessHandle.current().pid()) {
            return fail("already_running", "Scheduler already running with PID " + existing.get().pid());
        }
        pidFile.delete();

        SchedulerCore core = SchedulerCore.create(config);
        core.start();
        pidFile.write(ProcessHandle.current().pid());
        ConfigReloader reloader = new ConfigReloader(parent.configPath(), core);

        AtomicBoolean running = new AtomicBoolean(true);
        Thread main = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (running.compareAndSet(true, false)) {
                main.interrupt();
                core.shutdown();
                pidFile.delete();
            }
        }, "avscheduler-shutdown-hook"));

        System.out.println(Jsons.toJson(new StartOutcome(
                ProcessHandle.current().pid(),
                parent.configPath().toString(),
                config.settings().dbPath().toString(),
                config.jobs().size()
        )));
        long sleepMs = Math.max(100L, reloadIntervalMs);
        while (running.get()) {
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                break;
            }
            reloader.maybeReload().ifPresent(outcome -> System.out.println(Jsons.toJson(outcome)));
        }
        // Interrupted from inside the JVM: stop here, the hook then finds nothing to do.
        if (running.compareAndSet(true, false)) {
            core.shutdown();
            pidFile.delete();
        }
        return 0;
    }

    static StopOutcome stopDaemon(PidFile pidFile, long waitSeconds) throws InterruptedException, ExecutionException {
        Optional<ProcessHandle> process = pidFile.liveProcess();
        if (process.isEmpty()) {
            boolean stale = pidFile.delete();
            return new StopOutcome(false, null, stale, "scheduler is not running");
        }
        ProcessHandle handle = process.get();
        if (!handle.destroy()) {
            return new StopOutcome(false, handle.pid(), false, "could not signal PID " + handle.pid());
        }
        boolean exited;
        try {
            handle.onExit().get(waitSeconds, TimeUnit.SECONDS);
            exited = true;
        } catch (TimeoutException e) {
            exited = false;
        }
        if (exited) {
            pidFile.delete();
        }
        return new StopOutcome(
                exited,
                handle.pid(),
                false,
                exited ? "stopped" : "still shutting down after " + waitSeconds + "s"
        );
    }

    @Command(name = "status", description = "Show whether the scheduler is running and the job overview")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Override
        public Integer call() {
            SchedulerConfig config = parent.loadConfig();
            PidFile pidFile = new PidFile(config.settings().pidFile());
            Optional<ProcessHandle> process = pidFile.liveProcess();
            List<JobStatusView> jobs = SchedulerCore.create(config).listJobs();
            System.out.println(Jsons.toJson(new StatusOutcome(
                    process.isPresent(),
                    process.map(ProcessHandle::pid).orElse(null),
                    pidFile.path().toString(),
                    parent.configPath().toString(),
                    jobs
            )));
            return 0;
        }
    }

    @Command(name = "list-jobs", description = "List configured jobs with last run and next fire time")
    static final class ListJobsCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.core().listJobs()));
            return 0;
        }
    }

    @Command(name = "run-job", description = "Run a job once now, honoring its condition")
    static final class RunJobCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            RunOutcome outcome;
            try {
                outcome = parent.core().runNow(jobId);
            } catch (SchedulerException e) {
                return fail("run_failed", e.getMessage());
            }
            System.out.println(Jsons.toJson(outcome));
            return outcome.status() == RunStatus.EXECUTED && outcome.record().successful() ? 0 : 1;
        }
    }

    @Command(name = "view-logs", description = "Show execution history, newest first")
    static final class ViewLogsCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Option(names = {"--job-id"}, description = "Only this job")
        String jobId;

        @Option(names = {"--since"}, description = "Only executions started at or after this time")
        String since;

        @Option(names = {"--until"}, description = "Only executions started before this time")
        String until;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max records; 0 for all")
        int limit;

        @Override
        public Integer call() {
            SchedulerConfig config = parent.loadConfig();
            ExecutionLogStore store = new ExecutionLogStore(new Database(config.settings().dbPath()));
            store.init();
            Long fromMs;
            Long toMs;
            try {
                fromMs = since == null ? null : Timestamps.parse(since, config.settings().timezone()).toEpochMilli();
                toMs = until == null ? null : Timestamps.parse(until, config.settings().timezone()).toEpochMilli();
            } catch (IllegalArgumentException e) {
                return fail("invalid_timestamp", e.getMessage());
            }
            List<ExecutionRecord> records = store.list(jobId, fromMs, toMs, limit);
            System.out.println(Jsons.toJson(records));
            return 0;
        }
    }

    @Command(name = "cleanup-logs", description = "Delete execution history of a job")
    static final class CleanupLogsCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @ArgGroup(exclusive = true, multiplicity = "1")
        Range range;

        static final class Range {
            @Option(names = {"--before"}, required = true, description = "Delete records started before this time")
            String before;

            @Option(names = {"--all"}, required = true, description = "Delete every record of the job")
            boolean all;
        }

        @Override
        public Integer call() {
            SchedulerConfig config = parent.loadConfig();
            Instant cutoff;
            try {
                cutoff = range.before == null ? null : Timestamps.parse(range.before, config.settings().timezone());
            } catch (IllegalArgumentException e) {
                return fail("invalid_timestamp", e.getMessage());
            }
            int deleted = SchedulerCore.create(config).cleanupLogs(jobId, cutoff, range.all);
            System.out.println(Jsons.toJson(new CleanupOutcome(jobId, cutoff, range.all, deleted)));
            return 0;
        }
    }

    static class JobFields {
        @Option(names = {"--type"}, description = "Interpreter name from [interpreters]")
        String type;

        @Option(names = {"--command"}, description = "Inline program text passed to the interpreter")
        String command;

        @Option(names = {"--schedule"}, description = "Cron expression (5 fields)")
        String schedule;

        @Option(names = {"--interval-seconds"}, description = "Fixed interval instead of a cron schedule")
        Long intervalSeconds;

        @Option(names = {"--condition"}, description = "Gating condition, e.g. backup.last_run_successful")
        String condition;

        @Option(names = {"--env-file"}, description = "KEY=VALUE file overlaid on the environment")
        String envFile;

        @Option(names = {"--name"}, description = "Display name")
        String name;

        @Option(names = {"--timeout-seconds"}, description = "Kill the process after this many seconds")
        Long timeoutSeconds;

        ConfigDocument.JobSection toSection() {
            String scheduleType = null;
            if (intervalSeconds != null) {
                scheduleType = "interval";
            } else if (schedule != null) {
                scheduleType = "cron";
            }
            return new ConfigDocument.JobSection(
                    type,
                    schedule,
                    scheduleType,
                    intervalSeconds,
                    command,
                    condition,
                    envFile,
                    name,
                    timeoutSeconds
            );
        }
    }

    @Command(name = "add-job", description = "Add a job to the configuration file")
    static final class AddJobCommand extends JobFields implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            if (schedule == null && intervalSeconds == null) {
                return fail("invalid_job", "either --schedule or --interval-seconds is required");
            }
            try {
                System.out.println(Jsons.toJson(JobConfigEditor.addJob(parent.configPath(), jobId, toSection())));
                return 0;
            } catch (SchedulerException e) {
                return fail("invalid_job", e.getMessage());
            }
        }
    }

    @Command(name = "edit-job", description = "Change fields of an existing job")
    static final class EditJobCommand extends JobFields implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(JobConfigEditor.editJob(parent.configPath(), jobId, toSection())));
                return 0;
            } catch (SchedulerException e) {
                return fail("invalid_job", e.getMessage());
            }
        }
    }

    @Command(name = "delete-job", description = "Remove a job from the configuration file")
    static final class DeleteJobCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(JobConfigEditor.deleteJob(parent.configPath(), jobId)));
                return 0;
            } catch (SchedulerException e) {
                return fail("invalid_job", e.getMessage());
            }
        }
    }

    @Command(name = "reload-config", description = "Validate the configuration and signal the daemon to reload it")
    static final class ReloadConfigCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Override
        public Integer call() throws Exception {
            SchedulerConfig config;
            try {
                config = parent.loadConfig();
            } catch (SchedulerException e) {
                return fail("invalid_config", e.getMessage());
            }
            Files.setLastModifiedTime(parent.configPath(), FileTime.from(Instant.now()));
            boolean daemonRunning = new PidFile(config.settings().pidFile()).liveProcess().isPresent();
            System.out.println(Jsons.toJson(new ReloadRequestOutcome(
                    parent.configPath().toString(),
                    config.jobs().size(),
                    daemonRunning
            )));
            return 0;
        }
    }

    @Command(name = "serve-web", description = "Serve the read-only status pages")
    static final class ServeWebCommand implements Callable<Integer> {
        @ParentCommand
        AvSchedulerCommand parent;

        @Option(names = {"--host"}, description = "Bind address; defaults to web_server.host")
        String host;

        @Option(names = {"--port"}, description = "Bind port; defaults to web_server.port")
        Integer port;

        @Override
        public Integer call() throws Exception {
            SchedulerConfig config = parent.loadConfig();
            ExecutionLogStore store = new ExecutionLogStore(new Database(config.settings().dbPath()));
            store.init();
            StatusServer server = new StatusServer(
                    parent::loadConfig,
                    store,
                    Clock.systemUTC(),
                    host == null ? config.webServer().host() : host,
                    port == null ? config.webServer().port() : port
            );
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "avscheduler-web-shutdown"));
            System.out.println("Status server listening on http://" + (host == null ? config.webServer().host() : host)
                    + ":" + server.port());
            Thread.currentThread().join();
            return 0;
        }
    }

    record StartOutcome(long pid, String configFile, String dbPath, int jobs) {
    }

    record StopOutcome(boolean stopped, Long pid, boolean stalePidFileRemoved, String message) {
    }

    record StatusOutcome(boolean running, Long pid, String pidFile, String configFile, List<JobStatusView> jobs) {
    }

    record CleanupOutcome(String jobId, Instant before, boolean all, int deleted) {
    }

    record ReloadRequestOutcome(String configFile, int jobs, boolean daemonRunning) {
    }
}
