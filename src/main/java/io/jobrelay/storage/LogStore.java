package io.jobrelay.storage;

import io.jobrelay.model.LogKind;
import io.jobrelay.model.LogRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only per-job line history with an optional expiry.
 */
public final class LogStore {
    private final Database database;

    public LogStore(Database database) {
        this.database = database;
    }

    /**
     * Assigns the next sequence number for the job. Callers serialize appends per job.
     */
    public LogRecord append(String jobId, LogKind kind, String line, long nowMs) {
        String text = line == null ? "" : line;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ins = c.prepareStatement("""
                    INSERT INTO log_records(job_id,seq,kind,line,created_at_ms)
                    SELECT ?, COALESCE(MAX(seq),0)+1, ?, ?, ? FROM log_records WHERE job_id=?
                    """);
                 PreparedStatement max = c.prepareStatement("SELECT MAX(seq) FROM log_records WHERE job_id=?")) {
                ins.setString(1, jobId);
                ins.setString(2, kind.wireName());
                ins.setString(3, text);
                ins.setLong(4, nowMs);
                ins.setString(5, jobId);
                ins.executeUpdate();
                long seq;
                max.setString(1, jobId);
                try (ResultSet rs = max.executeQuery()) {
                    rs.next();
                    seq = rs.getLong(1);
                }
                c.commit();
                return new LogRecord(jobId, seq, kind, text, nowMs);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to append log line for job: " + jobId, e);
        }
    }

    public List<LogRecord> history(String jobId) {
        return range(jobId, 0L, Long.MAX_VALUE);
    }

    /**
     * Records with {@code afterSeq < seq < beforeSeq}, in sequence order.
     */
    public List<LogRecord> range(String jobId, long afterSeq, long beforeSeq) {
        List<LogRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT seq,kind,line,created_at_ms FROM log_records
                     WHERE job_id=? AND seq>? AND seq<? ORDER BY seq ASC
                     """)) {
            ps.setString(1, jobId);
            ps.setLong(2, afterSeq);
            ps.setLong(3, beforeSeq);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new LogRecord(
                            jobId,
                            rs.getLong("seq"),
                            LogKind.fromWire(rs.getString("kind")),
                            rs.getString("line"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read log history for job: " + jobId, e);
        }
    }

    public void expireAt(String jobId, long expiresAtMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT OR REPLACE INTO log_retention(job_id,expires_at_ms) VALUES(?,?)")) {
            ps.setString(1, jobId);
            ps.setLong(2, expiresAtMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to set log retention for job: " + jobId, e);
        }
    }

    public boolean hasEndMarker(String jobId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT 1 FROM log_records WHERE job_id=? AND kind=? AND line=? LIMIT 1")) {
            ps.setString(1, jobId);
            ps.setString(2, LogKind.CONTROL.wireName());
            ps.setString(3, LogRecord.END_OF_STREAM);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read end marker for job: " + jobId, e);
        }
    }

    public Long expiresAt(String jobId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT expires_at_ms FROM log_retention WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read log retention for job: " + jobId, e);
        }
    }

    public int delete(String jobId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement rec = c.prepareStatement("DELETE FROM log_records WHERE job_id=?");
                 PreparedStatement ret = c.prepareStatement("DELETE FROM log_retention WHERE job_id=?")) {
                rec.setString(1, jobId);
                int removed = rec.executeUpdate();
                ret.setString(1, jobId);
                ret.executeUpdate();
                c.commit();
                return removed;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to delete log history for job: " + jobId, e);
        }
    }

    public List<String> expiredJobIds(long nowMs) {
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT job_id FROM log_retention WHERE expires_at_ms<=?")) {
            ps.setLong(1, nowMs);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to scan expired log histories", e);
        }
    }
}
