/**
 * Scheduling orchestration package.
 *
 * <p>{@link io.avscheduler.scheduler.SchedulerCore} ties the trigger engine, condition
 * evaluator, execution engine and log store together; {@link io.avscheduler.scheduler.ConfigReloader}
 * feeds it configuration changes while the daemon runs.
 */
package io.avscheduler.scheduler;
