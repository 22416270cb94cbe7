package io.avscheduler.condition;

import java.time.Duration;

/**
 * One {@code <job_id>.<predicate>} term. {@code window} is set only for
 * {@link Predicate#FINISHED_WITHIN}.
 */
public record ConditionClause(String jobId, Predicate predicate, Duration window) {

    public enum Predicate {
        LAST_RUN_SUCCESSFUL("last_run_successful"),
        FINISHED_WITHIN("finished_within");

        private final String keyword;

        Predicate(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        static Predicate fromKeyword(String raw) {
            for (Predicate value : values()) {
                if (value.keyword.equals(raw)) {
                    return value;
                }
            }
            return null;
        }
    }
}
