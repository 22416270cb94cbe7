package io.avscheduler.scheduler;

import io.avscheduler.condition.ConditionEvaluator;
import io.avscheduler.condition.ConditionParser;
import io.avscheduler.config.JobDefinition;
import io.avscheduler.config.SchedulerConfig;
import io.avscheduler.config.Settings;
import io.avscheduler.exception.InterpreterNotConfiguredException;
import io.avscheduler.exception.InvalidConditionException;
import io.avscheduler.exception.InvalidScheduleException;
import io.avscheduler.exception.JobNotFoundException;
import io.avscheduler.exception.LogStoreException;
import io.avscheduler.execution.ExecutionEngine;
import io.avscheduler.execution.ExecutionOutcome;
import io.avscheduler.model.ExecutionRecord;
import io.avscheduler.model.JobStatusView;
import io.avscheduler.model.RunStatus;
import io.avscheduler.observability.ExecutionJournal;
import io.avscheduler.storage.Database;
import io.avscheduler.storage.ExecutionLogStore;
import io.avscheduler.trigger.ScheduleSpec;
import io.avscheduler.trigger.TriggerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the job registry, the dispatch loop and the worker pool.
 *
 * <p>The dispatch loop runs on a single thread at a fixed tick. For every due job it
 * advances the next fire time, checks the job's condition, claims the job's running
 * flag and hands the execution to a worker. It never waits on a subprocess. A firing
 * that finds the job still running is dropped, not queued.
 *
 * <p>The registry is an immutable map swapped as a whole on reload; each tick works
 * on the snapshot it read first.
 */
public final class SchedulerCore implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerCore.class);

    private final ExecutionLogStore logStore;
    private final ExecutionEngine engine;
    private final ConditionEvaluator conditions;
    private final TriggerEngine trigger;
    private final ExecutionJournal journal;
    private final Clock clock;

    private final Object registryLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile SchedulerConfig config;
    private volatile Map<String, JobRuntimeState> registry = Map.of();
    private volatile boolean prepared;

    private ScheduledExecutorService dispatcher;
    private ExecutorService workers;

    public SchedulerCore(
            SchedulerConfig config,
            ExecutionLogStore logStore,
            ExecutionEngine engine,
            ConditionEvaluator conditions,
            TriggerEngine trigger,
            ExecutionJournal journal,
            Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.logStore = Objects.requireNonNull(logStore, "logStore");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.conditions = Objects.requireNonNull(conditions, "conditions");
        this.trigger = Objects.requireNonNull(trigger, "trigger");
        this.journal = journal;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static SchedulerCore create(SchedulerConfig config) {
        Settings settings = config.settings();
        Clock clock = Clock.systemUTC();
        ExecutionLogStore store = new ExecutionLogStore(new Database(settings.dbPath()));
        return new SchedulerCore(
                config,
                store,
                new ExecutionEngine(clock),
                new ConditionEvaluator(store, clock),
                new TriggerEngine(settings.timezone()),
                new ExecutionJournal(settings.logFile(), settings.timezone()),
                clock
        );
    }

    public SchedulerConfig config() {
        return config;
    }

    /**
     * Initializes the store, builds the registry and starts dispatching. A corrupt store
     * aborts with {@link LogStoreException}; individual bad jobs are only rejected.
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("scheduler has been shut down");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("scheduler already started");
        }
        prepare();
        workers = Executors.newCachedThreadPool(namedThreads("avscheduler-worker-"));
        dispatcher = Executors.newSingleThreadScheduledExecutor(namedThreads("avscheduler-dispatch-"));
        long tick = config.settings().tickMillis();
        dispatcher.scheduleWithFixedDelay(this::tick, 0L, tick, TimeUnit.MILLISECONDS);
        LOG.info("Scheduler started with {} job(s), tick={}ms", registry.size(), tick);
    }

    /**
     * Stops issuing new firings at once, then waits up to the configured grace period for
     * running executions. Subprocesses still running after that are left alone.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (dispatcher != null) {
            dispatcher.shutdownNow();
        }
        if (workers == null) {
            LOG.info("Scheduler stopped");
            return;
        }
        workers.shutdown();
        long grace = config.settings().shutdownGraceSeconds();
        try {
            if (!workers.awaitTermination(grace, TimeUnit.SECONDS)) {
                List<String> active = new ArrayList<>();
                for (JobRuntimeState state : registry.values()) {
                    if (state.activeRun().isPresent() || state.running().get()) {
                        active.add(state.jobId());
                    }
                }
                LOG.warn("Executions still running after {}s grace period, leaving them to finish on their own: {}",
                        grace, active);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for running executions");
        }
        LOG.info("Scheduler stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    /**
     * Replaces the job set. Surviving jobs keep their running flag, and their next fire
     * time when the schedule did not change. Runs already in flight are not interrupted.
     */
    public ReloadOutcome reload(SchedulerConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig");
        prepare();
        synchronized (registryLock) {
            Map<String, JobRuntimeState> previous = registry;
            Map<String, JobRuntimeState> next = buildRegistry(newConfig, previous, clock.instant());

            List<String> added = new ArrayList<>();
            List<String> updated = new ArrayList<>();
            List<String> rescheduled = new ArrayList<>();
            List<String> unchanged = new ArrayList<>();
            Map<String, String> rejected = new LinkedHashMap<>();
            for (JobRuntimeState state : next.values()) {
                JobRuntimeState old = previous.get(state.jobId());
                if (old == null) {
                    added.add(state.jobId());
                } else if (!old.job().sameSchedule(state.job())) {
                    rescheduled.add(state.jobId());
                } else if (!old.job().equals(state.job())
                        || !Objects.equals(old.interpreterPath(), state.interpreterPath())) {
                    updated.add(state.jobId());
                } else {
                    unchanged.add(state.jobId());
                }
                if (state.rejectionReason() != null) {
                    rejected.put(state.jobId(), state.rejectionReason());
                }
            }
            List<String> removed = new ArrayList<>();
            for (String jobId : previous.keySet()) {
                if (!next.containsKey(jobId)) {
                    removed.add(jobId);
                }
            }

            if (!newConfig.settings().equals(config.settings())) {
                LOG.info("Settings changed on reload; database, timezone and tick changes apply after restart");
            }
            registry = next;
            config = newConfig;
            ReloadOutcome outcome = new ReloadOutcome(
                    List.copyOf(added),
                    List.copyOf(removed),
                    List.copyOf(updated),
                    List.copyOf(rescheduled),
                    List.copyOf(unchanged),
                    Collections.unmodifiableMap(rejected)
            );
            LOG.info("Configuration reloaded: added={} removed={} updated={} rescheduled={} rejected={}",
                    added, removed, updated, rescheduled, rejected.keySet());
            return outcome;
        }
    }

    /**
     * Runs a job immediately on the calling thread. The condition and the overlap guard
     * apply as for scheduled firings; the schedule itself is not moved.
     */
    public RunOutcome runNow(String jobId) {
        prepare();
        JobRuntimeState state = registry.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        if (state.interpreterPath() == null) {
            throw new InterpreterNotConfiguredException(jobId, state.job().type());
        }
        if (!state.scheduled()) {
            throw new InvalidScheduleException(state.rejectionReason());
        }
        if (state.job().hasCondition() && !conditions.evaluate(state.job().condition(), jobId)) {
            LOG.info("Manual run of job {} skipped: condition '{}' not met", jobId, state.job().condition());
            return RunOutcome.skipped(jobId, RunStatus.SKIPPED_CONDITION);
        }
        if (!state.running().compareAndSet(false, true)) {
            LOG.info("Manual run of job {} skipped: already running", jobId);
            return RunOutcome.skipped(jobId, RunStatus.SKIPPED_OVERLAP);
        }
        try {
            return RunOutcome.executed(executeAndRecord(state));
        } finally {
            state.running().set(false);
        }
    }

    public List<JobStatusView> listJobs() {
        prepare();
        List<JobStatusView> out = new ArrayList<>();
        for (JobRuntimeState state : registry.values()) {
            Instant next = state.nextFireTime();
            Instant last = state.lastFireTime();
            out.add(new JobStatusView(
                    state.jobId(),
                    state.job().displayName(),
                    logStore.latest(state.jobId()).orElse(null),
                    next == null ? null : next.toEpochMilli(),
                    last == null ? null : last.toEpochMilli(),
                    state.job().condition(),
                    state.running().get(),
                    state.scheduled(),
                    state.rejectionReason()
            ));
        }
        out.sort(Comparator.comparing(JobStatusView::jobId));
        return out;
    }

    public Optional<Instant> nextFireTime(String jobId) {
        JobRuntimeState state = registry.get(jobId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.nextFireTime());
    }

    public boolean isJobRunning(String jobId) {
        JobRuntimeState state = registry.get(jobId);
        return state != null && state.running().get();
    }

    /** Newest first; {@code null} returns every job's history. */
    public List<ExecutionRecord> getLogs(String jobId) {
        prepare();
        return logStore.list(jobId);
    }

    public int cleanupLogs(String jobId, Instant before, boolean all) {
        prepare();
        int deleted = logStore.delete(jobId, before, all);
        LOG.info("Removed {} execution record(s) of job {}", deleted, jobId);
        return deleted;
    }

    void tick() {
        try {
            Instant now = clock.instant();
            for (JobRuntimeState state : registry.values()) {
                if (stopped.get()) {
                    return;
                }
                try {
                    dispatchIfDue(state, now);
                } catch (RuntimeException e) {
                    LOG.error("Dispatch of job {} failed", state.jobId(), e);
                }
            }
        } catch (RuntimeException e) {
            LOG.error("Dispatch tick failed", e);
        }
    }

    private void dispatchIfDue(JobRuntimeState state, Instant now) {
        Instant due = state.nextFireTime();
        if (!state.scheduled() || due == null || now.isBefore(due)) {
            return;
        }
        try {
            state.nextFireTime(trigger.nextFireTime(state.spec(), now));
        } catch (InvalidScheduleException e) {
            LOG.warn("Job {} has no further fire time: {}", state.jobId(), e.getMessage());
            state.nextFireTime(null);
        }

        JobDefinition job = state.job();
        if (job.hasCondition() && !conditions.evaluate(job.condition(), job.jobId())) {
            LOG.info("Job {} skipped: condition '{}' not met", job.jobId(), job.condition());
            return;
        }
        if (!state.running().compareAndSet(false, true)) {
            LOG.info("Job {} still running, firing at {} dropped", job.jobId(), due);
            return;
        }
        try {
            state.activeRun(workers.submit(() -> runScheduled(state)));
            state.lastFireTime(now);
        } catch (RejectedExecutionException e) {
            state.running().set(false);
            LOG.warn("Job {} not dispatched: worker pool is shut down", job.jobId());
        }
    }

    private void runScheduled(JobRuntimeState state) {
        try {
            executeAndRecord(state);
        } catch (LogStoreException e) {
            LOG.error("Execution of job {} could not be recorded; it will run again on its next cycle", state.jobId(), e);
        } catch (RuntimeException e) {
            LOG.error("Execution of job {} failed", state.jobId(), e);
        } finally {
            state.running().set(false);
            rescheduleAfterRun(state);
        }
    }

    private void rescheduleAfterRun(JobRuntimeState finished) {
        JobRuntimeState current = registry.get(finished.jobId());
        if (current == null || current.running() != finished.running() || !current.scheduled()) {
            return;
        }
        try {
            current.nextFireTime(trigger.nextFireTime(current.spec(), clock.instant()));
        } catch (InvalidScheduleException e) {
            LOG.warn("Job {} has no further fire time: {}", current.jobId(), e.getMessage());
            current.nextFireTime(null);
        }
    }

    private ExecutionRecord executeAndRecord(JobRuntimeState state) {
        JobDefinition job = state.job();
        Path envFile = job.envFile() == null ? null : Path.of(job.envFile());
        Duration timeout = job.timeoutSeconds() > 0 ? Duration.ofSeconds(job.timeoutSeconds()) : null;
        LOG.info("Running job {} ({})", job.jobId(), job.displayName());
        ExecutionOutcome outcome = engine.execute(job.jobId(), state.interpreterPath(), job.command(), envFile, timeout);
        ExecutionRecord stored = logStore.append(outcome.record());
        if (journal != null) {
            try {
                journal.record(outcome);
            } catch (UncheckedIOException e) {
                LOG.warn("Execution journal write failed for job {}: {}", job.jobId(), e.getMessage());
            }
        }
        if (stored.successful()) {
            LOG.info("Job {} finished: exit={} time={}s", job.jobId(), stored.exitCode(), stored.durationSeconds());
        } else {
            LOG.warn("Job {} failed: exit={} time={}s", job.jobId(), stored.exitCode(), stored.durationSeconds());
        }
        return stored;
    }

    private void prepare() {
        if (prepared) {
            return;
        }
        synchronized (registryLock) {
            if (prepared) {
                return;
            }
            logStore.init();
            registry = buildRegistry(config, Map.of(), clock.instant());
            prepared = true;
        }
    }

    private Map<String, JobRuntimeState> buildRegistry(
            SchedulerConfig source,
            Map<String, JobRuntimeState> previous,
            Instant now
    ) {
        Map<String, JobRuntimeState> out = new LinkedHashMap<>();
        for (JobDefinition job : source.jobs().values()) {
            JobRuntimeState old = previous.get(job.jobId());
            AtomicBoolean running = old == null ? new AtomicBoolean(false) : old.running();
            String interpreter = source.interpreterFor(job).orElse(null);

            ScheduleSpec spec = null;
            String rejection = null;
            Instant next = null;
            try {
                spec = job.scheduleSpec();
                if (old != null && old.scheduled() && old.job().sameSchedule(job) && old.nextFireTime() != null) {
                    next = old.nextFireTime();
                } else {
                    next = trigger.nextFireTime(spec, now);
                }
            } catch (InvalidScheduleException e) {
                rejection = e.getMessage();
            }
            if (rejection == null && interpreter == null) {
                rejection = new InterpreterNotConfiguredException(job.jobId(), job.type()).getMessage();
            }
            if (rejection != null) {
                LOG.warn("Job {} rejected: {}", job.jobId(), rejection);
                next = null;
            }
            if (job.hasCondition()) {
                try {
                    ConditionParser.parse(job.condition());
                } catch (InvalidConditionException e) {
                    LOG.warn("Job {} has an invalid condition and will be skipped until it is fixed: {}",
                            job.jobId(), e.getMessage());
                }
            }
            out.put(job.jobId(), new JobRuntimeState(
                    job,
                    spec,
                    interpreter,
                    rejection,
                    running,
                    next,
                    old == null ? null : old.lastFireTime(),
                    old == null ? null : old.activeRunHandle()
            ));
        }
        return Collections.unmodifiableMap(out);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
