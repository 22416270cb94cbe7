package io.avscheduler.scheduler;

import java.util.List;
import java.util.Map;

/**
 * What a configuration reload changed. {@code rejected} maps job id to the reason the
 * job will not be scheduled; those ids also appear in one of the other lists.
 */
public record ReloadOutcome(
        List<String> added,
        List<String> removed,
        List<String> updated,
        List<String> rescheduled,
        List<String> unchanged,
        Map<String, String> rejected
) {
    public boolean changed() {
        return !added.isEmpty() || !removed.isEmpty() || !updated.isEmpty() || !rescheduled.isEmpty();
    }
}
