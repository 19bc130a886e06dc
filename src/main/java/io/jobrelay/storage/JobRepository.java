package io.jobrelay.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.model.JobRecord;
import io.jobrelay.model.JobStatus;
import io.jobrelay.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Execution records plus their status registries. A job id sits in exactly one registry,
 * matching its {@code status} column; both change inside one transaction.
 */
public final class JobRepository {
    private static final String JOB_COLUMNS = """
            job_id,status,args,meta,enqueued_at_ms,started_at_ms,ended_at_ms,result,error,
            timeout_ms,result_ttl_s,failure_ttl_s,stop_requested,version
            """;

    private final Database database;
    private final int registryMaxSize;

    public JobRepository(Database database, int registryMaxSize) {
        this.database = database;
        this.registryMaxSize = Math.max(1, registryMaxSize);
    }

    public int registryMaxSize() {
        return registryMaxSize;
    }

    public boolean exists(String jobId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM jobs WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to check job: " + jobId, e);
        }
    }

    /**
     * @return false when a record with this id already exists
     */
    public boolean insertQueued(NewJob job) {
        if (exists(job.jobId())) {
            return false;
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ins = c.prepareStatement(
                    "INSERT INTO jobs(job_id,status,args,meta,enqueued_at_ms,timeout_ms,result_ttl_s,failure_ttl_s) VALUES(?,?,?,?,?,?,?,?)")) {
                ins.setString(1, job.jobId());
                ins.setString(2, JobStatus.QUEUED.wireName());
                ins.setString(3, Jsons.toCompactJson(job.args()));
                ins.setString(4, Jsons.toCompactJson(job.meta()));
                ins.setLong(5, job.enqueuedAtMs());
                ins.setLong(6, job.timeoutMs());
                ins.setLong(7, job.resultTtlSeconds());
                ins.setLong(8, job.failureTtlSeconds());
                ins.executeUpdate();
                addToRegistry(c, JobStatus.QUEUED, job.jobId(), job.enqueuedAtMs());
                c.commit();
                return true;
            } catch (SQLException e) {
                c.rollback();
                if (exists(job.jobId())) {
                    return false;
                }
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to enqueue job: " + job.jobId(), e);
        }
    }

    public Optional<JobRecord> find(String jobId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + JOB_COLUMNS + " FROM jobs WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapJob(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to fetch job: " + jobId, e);
        }
    }

    public List<JobRecord> findMany(Collection<String> jobIds) {
        List<JobRecord> out = new ArrayList<>();
        for (String id : jobIds) {
            find(id).ifPresent(out::add);
        }
        return out;
    }

    /**
     * Oldest queued job first. Claims are serialized in-process; the conditional update
     * fences claims from other processes sharing the same store.
     */
    public synchronized Optional<JobRecord> claimNext(String workerId, long nowMs) {
        for (String candidate : registryIds(JobStatus.QUEUED, 16)) {
            if (tryClaim(candidate, workerId, nowMs)) {
                return find(candidate);
            }
        }
        return Optional.empty();
    }

    private boolean tryClaim(String jobId, String workerId, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(
                    "UPDATE jobs SET status=?,started_at_ms=?,worker_id=?,version=version+1 WHERE job_id=? AND status=?")) {
                up.setString(1, JobStatus.STARTED.wireName());
                up.setLong(2, nowMs);
                up.setString(3, workerId);
                up.setString(4, jobId);
                up.setString(5, JobStatus.QUEUED.wireName());
                if (up.executeUpdate() != 1) {
                    c.rollback();
                    return false;
                }
                moveRegistry(c, jobId, JobStatus.QUEUED, JobStatus.STARTED, nowMs);
                c.commit();
                return true;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to claim job: " + jobId, e);
        }
    }

    /**
     * @return false when the record vanished (removed while running)
     */
    public boolean updateMeta(String jobId, Map<String, Object> meta) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE jobs SET meta=?,version=version+1 WHERE job_id=?")) {
            ps.setString(1, Jsons.toCompactJson(meta));
            ps.setString(2, jobId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to save meta for job: " + jobId, e);
        }
    }

    /**
     * A record that no longer exists counts as stopped.
     */
    public boolean isStopRequested(String jobId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT stop_requested FROM jobs WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return !rs.next() || rs.getInt(1) == 1;
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read stop flag for job: " + jobId, e);
        }
    }

    public boolean requestStop(String jobId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE jobs SET stop_requested=1,version=version+1 WHERE job_id=? AND status=?")) {
            ps.setString(1, jobId);
            ps.setString(2, JobStatus.STARTED.wireName());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to request stop for job: " + jobId, e);
        }
    }

    public boolean cancelQueued(String jobId, long nowMs) {
        Optional<JobRecord> current = find(jobId);
        if (current.isEmpty()) {
            return false;
        }
        Completion completion = transition(
                jobId, JobStatus.QUEUED, JobStatus.STOPPED, null, "Job was stopped before it started.",
                current.get().meta(), nowMs, current.get().failureTtlSeconds());
        return completion.updated();
    }

    /**
     * Moves a started job into its terminal registry and trims finished/failed registries
     * to the configured cap. Evicted job records are deleted with their registry entries.
     */
    public Completion complete(String jobId, JobStatus terminal, String result, String error,
                               Map<String, Object> meta, long nowMs) {
        if (!terminal.terminal()) {
            throw new IllegalArgumentException("not a terminal status: " + terminal);
        }
        Optional<JobRecord> current = find(jobId);
        if (current.isEmpty()) {
            return new Completion(false, List.of());
        }
        long ttl = terminal == JobStatus.FINISHED
                ? current.get().resultTtlSeconds()
                : current.get().failureTtlSeconds();
        return transition(jobId, JobStatus.STARTED, terminal, result, error, meta, nowMs, ttl);
    }

    private Completion transition(String jobId, JobStatus from, JobStatus to, String result, String error,
                                  Map<String, Object> meta, long nowMs, long ttlSeconds) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement("""
                    UPDATE jobs SET status=?,ended_at_ms=?,result=?,error=?,meta=?,expires_at_ms=?,version=version+1
                    WHERE job_id=? AND status=?
                    """)) {
                up.setString(1, to.wireName());
                up.setLong(2, nowMs);
                setNullableString(up, 3, result);
                setNullableString(up, 4, error);
                up.setString(5, Jsons.toCompactJson(meta == null ? Map.of() : meta));
                up.setLong(6, nowMs + Math.max(0L, ttlSeconds) * 1000L);
                up.setString(7, jobId);
                up.setString(8, from.wireName());
                if (up.executeUpdate() != 1) {
                    c.rollback();
                    return new Completion(false, List.of());
                }
                moveRegistry(c, jobId, from, to, nowMs);
                List<String> evicted = (to == JobStatus.FINISHED || to == JobStatus.FAILED)
                        ? trimRegistry(c, to)
                        : List.of();
                c.commit();
                return new Completion(true, evicted);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to finalize job: " + jobId, e);
        }
    }

    /**
     * Deletes the job record and every registry entry, fenced by the version read by the
     * caller. A concurrent worker update bumps the version and surfaces as locked.
     */
    public boolean delete(String jobId, long expectedVersion) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement del = c.prepareStatement("DELETE FROM jobs WHERE job_id=? AND version=?");
                 PreparedStatement reg = c.prepareStatement("DELETE FROM job_registry WHERE job_id=?")) {
                del.setString(1, jobId);
                del.setLong(2, expectedVersion);
                int removed = del.executeUpdate();
                if (removed == 0) {
                    c.rollback();
                    if (exists(jobId)) {
                        throw new JobLockedException(jobId);
                    }
                    return false;
                }
                reg.setString(1, jobId);
                reg.executeUpdate();
                c.commit();
                return true;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            if (Database.isLockContention(e)) {
                throw new JobLockedException(jobId, e);
            }
            throw new StorageUnavailableException("Failed to remove job: " + jobId, e);
        }
    }

    /**
     * Queued ids come back oldest first; every other registry newest first.
     */
    public List<String> registryIds(JobStatus registry, int limit) {
        String order = registry == JobStatus.QUEUED ? "ASC" : "DESC";
        String sql = "SELECT job_id FROM job_registry WHERE registry=? ORDER BY entry_id " + order + " LIMIT ?";
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, registry.wireName());
            ps.setInt(2, limit <= 0 ? Integer.MAX_VALUE : limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read registry: " + registry.wireName(), e);
        }
    }

    public int registrySize(JobStatus registry) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM job_registry WHERE registry=?")) {
            ps.setString(1, registry.wireName());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to count registry: " + registry.wireName(), e);
        }
    }

    /**
     * Registries that currently hold the id. More than one entry means a broken invariant.
     */
    public List<String> registriesOf(String jobId) {
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT registry FROM job_registry WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read registries of job: " + jobId, e);
        }
    }

    public List<String> expiredTerminalJobs(long nowMs) {
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT job_id FROM jobs WHERE expires_at_ms IS NOT NULL AND expires_at_ms<=? AND status IN (?,?,?)")) {
            ps.setLong(1, nowMs);
            ps.setString(2, JobStatus.FINISHED.wireName());
            ps.setString(3, JobStatus.FAILED.wireName());
            ps.setString(4, JobStatus.STOPPED.wireName());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to scan expired jobs", e);
        }
    }

    private void addToRegistry(Connection c, JobStatus registry, String jobId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT OR IGNORE INTO job_registry(registry,job_id,added_at_ms) VALUES(?,?,?)")) {
            ps.setString(1, registry.wireName());
            ps.setString(2, jobId);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        }
    }

    private void moveRegistry(Connection c, String jobId, JobStatus from, JobStatus to, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM job_registry WHERE registry=? AND job_id=?")) {
            ps.setString(1, from.wireName());
            ps.setString(2, jobId);
            ps.executeUpdate();
        }
        addToRegistry(c, to, jobId, nowMs);
    }

    private List<String> trimRegistry(Connection c, JobStatus registry) throws SQLException {
        List<String> evicted = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT job_id FROM job_registry WHERE registry=?
                ORDER BY entry_id DESC LIMIT -1 OFFSET ?
                """)) {
            ps.setString(1, registry.wireName());
            ps.setInt(2, registryMaxSize);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    evicted.add(rs.getString(1));
                }
            }
        }
        if (evicted.isEmpty()) {
            return evicted;
        }
        try (PreparedStatement reg = c.prepareStatement("DELETE FROM job_registry WHERE job_id=?");
             PreparedStatement job = c.prepareStatement("DELETE FROM jobs WHERE job_id=?")) {
            for (String id : evicted) {
                reg.setString(1, id);
                reg.executeUpdate();
                job.setString(1, id);
                job.executeUpdate();
            }
        }
        return evicted;
    }

    private JobRecord mapJob(ResultSet rs) throws SQLException {
        ObjectNode args = Jsons.readObject(rs.getString("args"));
        Map<String, Object> meta = new LinkedHashMap<>(Jsons.readMap(rs.getString("meta")));
        return new JobRecord(
                rs.getString("job_id"),
                JobStatus.fromWire(rs.getString("status")),
                args,
                meta,
                nullableLong(rs, "enqueued_at_ms"),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "ended_at_ms"),
                rs.getString("result"),
                rs.getString("error"),
                rs.getLong("timeout_ms"),
                rs.getLong("result_ttl_s"),
                rs.getLong("failure_ttl_s"),
                rs.getInt("stop_requested") == 1,
                rs.getLong("version")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    public record NewJob(
            String jobId,
            ObjectNode args,
            Map<String, Object> meta,
            long enqueuedAtMs,
            long timeoutMs,
            long resultTtlSeconds,
            long failureTtlSeconds
    ) {
    }

    public record Completion(boolean updated, List<String> evictedJobIds) {
    }
}
