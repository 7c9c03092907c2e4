package com.labpulse.persistence;

import com.labpulse.model.CardStatusMapping;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

@Repository
public class JdbcCardStatusMappingRepository implements CardStatusMappingRepository {

    private final DataSource dataSource;

    public JdbcCardStatusMappingRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<CardStatusMapping> listStatusCards() {
        String sql = "SELECT id, status_source_id, status_monitor_name FROM cards WHERE show_status = TRUE ORDER BY id";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            List<CardStatusMapping> out = new ArrayList<>();
            while (rs.next()) {
                long source = rs.getLong("status_source_id");
                Long sourceId = rs.wasNull() ? null : source;
                out.add(CardStatusMapping.builder()
                        .cardId(rs.getLong("id"))
                        .statusSourceId(sourceId)
                        .monitorName(rs.getString("status_monitor_name"))
                        .build());
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list status cards", e);
        }
    }
}
