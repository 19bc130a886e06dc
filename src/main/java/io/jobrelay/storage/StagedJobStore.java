package io.jobrelay.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.jobrelay.model.StagedJob;
import io.jobrelay.util.Jsons;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Staged-job hash: parameter bundles accepted but not yet submitted for execution.
 */
public final class StagedJobStore {
    private static final Logger LOG = LogManager.getLogger(StagedJobStore.class);

    private final Database database;

    public StagedJobStore(Database database) {
        this.database = database;
    }

    public String stage(ObjectNode params) {
        if (params == null) {
            throw new IllegalArgumentException("params must not be null");
        }
        String id = StagedJob.ID_PREFIX + UUID.randomUUID();
        put(new StagedJob(id, params, Instant.now().toEpochMilli()));
        return id;
    }

    void put(StagedJob job) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT OR REPLACE INTO staged_jobs(staged_id,params,staged_at_ms) VALUES(?,?,?)")) {
            ps.setString(1, job.id());
            ps.setString(2, Jsons.toCompactJson(job.params()));
            ps.setLong(3, job.stagedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to stage job", e);
        }
    }

    /**
     * Corrupted parameter blobs are dropped from the store and reported as
     * {@link IllegalStateException} so the caller can ask for a re-stage.
     */
    public Optional<StagedJob> fetchStaged(String id) {
        String sql = "SELECT staged_id,params,staged_at_ms FROM staged_jobs WHERE staged_id=?";
        String raw;
        long stagedAt;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                raw = rs.getString("params");
                stagedAt = rs.getLong("staged_at_ms");
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to fetch staged job: " + id, e);
        }
        try {
            return Optional.of(new StagedJob(id, Jsons.readObject(raw), stagedAt));
        } catch (IllegalArgumentException e) {
            LOG.error("Corrupted staged job data for {}: {}. Removing entry.", id, e.getMessage());
            removeStaged(id);
            throw new IllegalStateException("Corrupted staged job data for " + id + ". Please re-stage.", e);
        }
    }

    public boolean removeStaged(String id) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM staged_jobs WHERE staged_id=?")) {
            ps.setString(1, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to remove staged job: " + id, e);
        }
    }

    public List<StagedJob> listStaged() {
        List<StagedJob> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT staged_id,params,staged_at_ms FROM staged_jobs ORDER BY staged_at_ms DESC");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String id = rs.getString("staged_id");
                try {
                    out.add(new StagedJob(id, Jsons.readObject(rs.getString("params")), rs.getLong("staged_at_ms")));
                } catch (IllegalArgumentException e) {
                    LOG.error("Error parsing staged job {}: {}", id, e.getMessage());
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to list staged jobs", e);
        }
    }
}
