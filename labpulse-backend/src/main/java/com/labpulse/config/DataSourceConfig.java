package com.labpulse.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connection pool for the integration/settings store.
 */
@Configuration
public class DataSourceConfig {
    private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

    @Value("${labpulse.datasource.url:jdbc:h2:file:./data/labpulse;AUTO_SERVER=TRUE}")
    private String url;

    @Value("${labpulse.datasource.username:sa}")
    private String username;

    @Value("${labpulse.datasource.password:}")
    private String password;

    @Value("${labpulse.datasource.maximum-pool-size:5}")
    private int maximumPoolSize;

    @Value("${labpulse.datasource.init-schema:true}")
    private boolean initSchema;

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(1);
        config.setPoolName("labpulse-store");

        HikariDataSource ds = new HikariDataSource(config);
        log.info("Opened store pool: url={}, maximum_pool_size={}", url, maximumPoolSize);
        if (initSchema) {
            try {
                SchemaInitializer.apply(ds, "/schema.sql");
            } catch (RuntimeException e) {
                ds.close();
                throw e;
            }
        }
        return ds;
    }
}
