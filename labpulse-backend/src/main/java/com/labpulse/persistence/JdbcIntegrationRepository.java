package com.labpulse.persistence;

import com.labpulse.model.Integration;
import com.labpulse.model.PollOutcome;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcIntegrationRepository implements IntegrationRepository {

    private static final String COLUMNS =
            "id, service_name, service_type, credentials, poll_interval, is_active, last_poll_at, last_status";

    private final DataSource dataSource;

    public JdbcIntegrationRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Integration> listActiveIntegrations() {
        String sql = "SELECT " + COLUMNS + " FROM integrations WHERE is_active = TRUE ORDER BY service_name, id";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<Integration> out = new ArrayList<>();
            while (rs.next()) {
                out.add(map(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list active integrations", e);
        }
    }

    @Override
    public Optional<Integration> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM integrations WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load integration " + id, e);
        }
    }

    @Override
    public void updateLastPoll(long id, PollOutcome outcome, Instant timestamp) {
        String sql = "UPDATE integrations SET last_poll_at = ?, last_status = ?, updated_at = ? WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            Timestamp ts = Timestamp.from(timestamp);
            ps.setTimestamp(1, ts);
            ps.setString(2, outcome.wireName());
            ps.setTimestamp(3, ts);
            ps.setLong(4, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update last poll for integration " + id, e);
        }
    }

    private static Integration map(ResultSet rs) throws SQLException {
        Timestamp lastPoll = rs.getTimestamp("last_poll_at");
        long interval = rs.getLong("poll_interval");
        Long pollInterval = rs.wasNull() ? null : interval;
        return Integration.builder()
                .id(rs.getLong("id"))
                .serviceName(rs.getString("service_name"))
                .serviceType(rs.getString("service_type"))
                .credentials(rs.getString("credentials"))
                .pollIntervalMs(pollInterval)
                .active(rs.getBoolean("is_active"))
                .lastPollAt(lastPoll != null ? lastPoll.toInstant() : null)
                .lastStatus(PollOutcome.fromWireName(rs.getString("last_status")))
                .build();
    }
}
