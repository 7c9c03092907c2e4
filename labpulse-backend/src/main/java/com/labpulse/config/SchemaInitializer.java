package com.labpulse.config;

import com.labpulse.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Runs an idempotent bootstrap script from the classpath. Statements are separated by {@code ;}.
 */
public final class SchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    private SchemaInitializer() {
    }

    public static void apply(DataSource dataSource, String resource) {
        String script;
        try (InputStream is = SchemaInitializer.class.getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("{} not found on classpath", resource);
                return;
            }
            script = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + resource, e);
        }

        int executed = 0;
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String statement : script.split(";")) {
                String sql = stripComments(statement);
                if (sql.isBlank()) {
                    continue;
                }
                st.execute(sql);
                executed++;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to apply " + resource, e);
        }
        log.info("Applied schema script: resource={}, statements={}", resource, executed);
    }

    private static String stripComments(String statement) {
        StringBuilder sb = new StringBuilder();
        for (String line : statement.split("\n")) {
            if (!line.trim().startsWith("--")) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString().trim();
    }
}
