package io.avscheduler.storage;

import io.avscheduler.exception.LogStoreException;
import io.avscheduler.model.ExecutionRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only history of job executions. Writers are serialized; reads run concurrently
 * and only ever observe committed rows.
 */
public final class ExecutionLogStore {
    private static final String COLUMNS = "id,job_id,exit_code,execution_time,timestamp_ms";

    private final Database database;
    private final ReentrantLock writeLock = new ReentrantLock();

    public ExecutionLogStore(Database database) {
        this.database = database;
    }

    /** Prepares the backing database; see {@link Database#init()}. */
    public void init() {
        database.init();
    }

    public ExecutionRecord append(ExecutionRecord record) {
        writeLock.lock();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO job_execution_logs(job_id,exit_code,execution_time,timestamp_ms) VALUES(?,?,?,?)",
                     Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, record.jobId());
            ps.setInt(2, record.exitCode());
            ps.setDouble(3, record.durationSeconds());
            ps.setLong(4, record.timestampMs());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new LogStoreException("No id generated for execution of job " + record.jobId());
                }
                return record.withId(keys.getLong(1));
            }
        } catch (SQLException e) {
            throw new LogStoreException("Failed to append execution of job " + record.jobId(), e);
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<ExecutionRecord> latest(String jobId) {
        String sql = "SELECT " + COLUMNS + " FROM job_execution_logs WHERE job_id=? ORDER BY timestamp_ms DESC, id DESC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new LogStoreException("Failed to read latest execution of job " + jobId, e);
        }
    }

    /** All records, newest first. A null {@code jobId} lists every job. */
    public List<ExecutionRecord> list(String jobId) {
        return list(jobId, null, null, 0);
    }

    /**
     * Records newest first, optionally limited to a job and to {@code fromMs <= timestamp < toMs}.
     * A non-positive {@code limit} means no limit.
     */
    public List<ExecutionRecord> list(String jobId, Long fromMs, Long toMs, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM job_execution_logs WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (jobId != null) {
            sql.append(" AND job_id=?");
            args.add(jobId);
        }
        if (fromMs != null) {
            sql.append(" AND timestamp_ms>=?");
            args.add(fromMs);
        }
        if (toMs != null) {
            sql.append(" AND timestamp_ms<?");
            args.add(toMs);
        }
        sql.append(" ORDER BY timestamp_ms DESC, id DESC");
        if (limit > 0) {
            sql.append(" LIMIT ?");
            args.add(limit);
        }
        List<ExecutionRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) {
                ps.setObject(i + 1, args.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new LogStoreException("Failed to list executions", e);
        }
    }

    /**
     * Removes a job's records: all of them when {@code all} is set, otherwise those
     * started strictly before {@code before}. Returns the number of rows removed.
     */
    public int delete(String jobId, Instant before, boolean all) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }
        if (!all && before == null) {
            throw new IllegalArgumentException("Either a cutoff timestamp or all=true is required");
        }
        String sql = all
                ? "DELETE FROM job_execution_logs WHERE job_id=?"
                : "DELETE FROM job_execution_logs WHERE job_id=? AND timestamp_ms<?";
        writeLock.lock();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            if (!all) {
                ps.setLong(2, before.toEpochMilli());
            }
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new LogStoreException("Failed to delete executions of job " + jobId, e);
        } finally {
            writeLock.unlock();
        }
    }

    public int deleteAll() {
        writeLock.lock();
        try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
            return st.executeUpdate("DELETE FROM job_execution_logs");
        } catch (SQLException e) {
            throw new LogStoreException("Failed to delete executions", e);
        } finally {
            writeLock.unlock();
        }
    }

    private ExecutionRecord map(ResultSet rs) throws SQLException {
        return new ExecutionRecord(
                rs.getLong("id"),
                rs.getString("job_id"),
                rs.getInt("exit_code"),
                rs.getDouble("execution_time"),
                rs.getLong("timestamp_ms")
        );
    }
}
