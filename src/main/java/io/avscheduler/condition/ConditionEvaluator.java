package io.avscheduler.condition;

import io.avscheduler.exception.InvalidConditionException;
import io.avscheduler.model.ExecutionRecord;
import io.avscheduler.storage.ExecutionLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Answers whether a gated job may run now, reading only the execution log.
 *
 * <p>Fails closed: a malformed expression evaluates to {@code false} with a warning,
 * and so does any clause whose job has no recorded execution.
 */
public final class ConditionEvaluator {
    private static final Logger LOG = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final ExecutionLogStore logStore;
    private final Clock clock;

    public ConditionEvaluator(ExecutionLogStore logStore, Clock clock) {
        this.logStore = logStore;
        this.clock = clock;
    }

    public boolean evaluate(String expression, String subjectJobId) {
        List<ConditionClause> clauses;
        try {
            clauses = ConditionParser.parse(expression);
        } catch (InvalidConditionException e) {
            LOG.warn("Condition of job {} is invalid, treating as not met: {}", subjectJobId, e.getMessage());
            return false;
        }
        Instant now = clock.instant();
        for (ConditionClause clause : clauses) {
            if (!holds(clause, now)) {
                LOG.debug("Condition clause {}.{} not met for job {}",
                        clause.jobId(), clause.predicate().keyword(), subjectJobId);
                return false;
            }
        }
        return true;
    }

    private boolean holds(ConditionClause clause, Instant now) {
        Optional<ExecutionRecord> latest = logStore.latest(clause.jobId());
        if (latest.isEmpty()) {
            return false;
        }
        ExecutionRecord record = latest.get();
        return switch (clause.predicate()) {
            case LAST_RUN_SUCCESSFUL -> record.successful();
            case FINISHED_WITHIN -> Duration.between(record.startedAt(), now).compareTo(clause.window()) <= 0;
        };
    }
}
