package io.avscheduler.condition;

import io.avscheduler.exception.InvalidConditionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses gating expressions such as
 * {@code backup.last_run_successful and backup.finished_within(2h)}.
 *
 * <p>Clauses are joined with {@code and}. Job ids are case-sensitive and may contain
 * dots; the predicate is whatever follows the last dot.
 */
public final class ConditionParser {
    private static final Pattern AND = Pattern.compile("\\s+and\\s+");
    private static final Pattern CLAUSE = Pattern.compile(
            "^(?<job>[^\\s()]+)\\.(?<predicate>[A-Za-z_]+)(?:\\((?<arg>[^()]*)\\))?$"
    );
    private static final Pattern DURATION = Pattern.compile("^(?<amount>\\d+)(?<unit>[A-Za-z]*)$");

    private ConditionParser() {
    }

    /** Returns an empty list for a blank expression (no constraint). */
    public static List<ConditionClause> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return List.of();
        }
        List<ConditionClause> out = new ArrayList<>();
        for (String raw : AND.split(expression.trim(), -1)) {
            out.add(parseClause(raw.trim(), expression));
        }
        return List.copyOf(out);
    }

    private static ConditionClause parseClause(String raw, String expression) {
        if (raw.isEmpty()) {
            throw new InvalidConditionException("empty clause in condition '" + expression + "'");
        }
        Matcher m = CLAUSE.matcher(raw);
        if (!m.matches()) {
            throw new InvalidConditionException("malformed clause '" + raw + "' in condition '" + expression + "'");
        }
        String jobId = m.group("job");
        String keyword = m.group("predicate");
        String arg = m.group("arg");
        ConditionClause.Predicate predicate = ConditionClause.Predicate.fromKeyword(keyword);
        if (predicate == null) {
            throw new InvalidConditionException("unknown predicate '" + keyword + "' in condition '" + expression + "'");
        }
        return switch (predicate) {
            case LAST_RUN_SUCCESSFUL -> {
                if (arg != null) {
                    throw new InvalidConditionException("last_run_successful takes no argument: '" + raw + "'");
                }
                yield new ConditionClause(jobId, predicate, null);
            }
            case FINISHED_WITHIN -> {
                if (arg == null) {
                    throw new InvalidConditionException("finished_within requires a duration: '" + raw + "'");
                }
                yield new ConditionClause(jobId, predicate, parseDuration(arg.trim()));
            }
        };
    }

    /**
     * Parses {@code <n>h}, {@code <n>m} or {@code <n>s}. Any other unit is rejected.
     */
    public static Duration parseDuration(String raw) {
        Matcher m = DURATION.matcher(raw == null ? "" : raw.trim());
        if (!m.matches()) {
            throw new InvalidConditionException("invalid duration '" + raw + "', expected <integer><h|m|s>");
        }
        long amount;
        try {
            amount = Long.parseLong(m.group("amount"));
        } catch (NumberFormatException e) {
            throw new InvalidConditionException("duration out of range: '" + raw + "'", e);
        }
        try {
            return switch (m.group("unit")) {
                case "h" -> Duration.ofHours(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "s" -> Duration.ofSeconds(amount);
                default -> throw new InvalidConditionException(
                        "unrecognized duration unit in '" + raw + "', expected h, m or s"
                );
            };
        } catch (ArithmeticException e) {
            throw new InvalidConditionException("duration out of range: '" + raw + "'", e);
        }
    }
}
