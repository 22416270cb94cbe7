/**
 * avscheduler source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.avscheduler.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.avscheduler.cli.AvSchedulerCommand} maps commands to scheduler APIs.</li>
 *   <li>{@code io.avscheduler.scheduler.SchedulerCore} owns the registry, dispatch loop and workers.</li>
 *   <li>{@code io.avscheduler.storage.ExecutionLogStore} is the authoritative execution history.</li>
 * </ul>
 */
package io.avscheduler;
