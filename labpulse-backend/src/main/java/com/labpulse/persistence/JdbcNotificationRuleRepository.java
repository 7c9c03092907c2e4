package com.labpulse.persistence;

import com.labpulse.model.NotificationRule;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

@Repository
public class JdbcNotificationRuleRepository implements NotificationRuleRepository {

    private final DataSource dataSource;

    public JdbcNotificationRuleRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<NotificationRule> listActiveRules(long integrationId) {
        String sql = "SELECT id, name, integration_id, metric_key, threshold_operator, threshold_value, cooldown_minutes, severity "
                + "FROM notification_rules WHERE is_active = TRUE AND integration_id = ? ORDER BY id";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, integrationId);
            try (ResultSet rs = ps.executeQuery()) {
                List<NotificationRule> out = new ArrayList<>();
                while (rs.next()) {
                    int cooldown = rs.getInt("cooldown_minutes");
                    out.add(NotificationRule.builder()
                            .id(rs.getLong("id"))
                            .name(rs.getString("name"))
                            .integrationId(rs.getLong("integration_id"))
                            .metricKey(rs.getString("metric_key"))
                            .operator(rs.getString("threshold_operator"))
                            .threshold(rs.getDouble("threshold_value"))
                            .cooldownMinutes(rs.wasNull() ? null : cooldown)
                            .severity(rs.getString("severity"))
                            .build());
                }
                return out;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list notification rules: integration_id=" + integrationId, e);
        }
    }
}
