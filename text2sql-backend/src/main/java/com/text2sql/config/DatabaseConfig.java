package com.text2sql.config;

import com.text2sql.service.HikariSqlExceptionOverride;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;

/**
 * Owns the process-wide database handle.
 *
 * <p>The pool is capped at one physical connection, so every pipeline run borrows the same
 * SQLite connection. The Spring context closes the pool on shutdown.
 */
@Slf4j
@Configuration
public class DatabaseConfig {

    static final String DEFAULT_DATABASE_PATH = "data/chinook.db";
    private static final int CONNECTION_TIMEOUT_MS = 30000;

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(Environment environment) {
        String path = resolveDatabasePath(environment);
        log.info("Opening SQLite database (path={})", path);

        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setDriverClassName("org.sqlite.JDBC");
        config.setJdbcUrl("jdbc:sqlite:" + path);
        config.setAutoCommit(false);
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(CONNECTION_TIMEOUT_MS);
        // keep the single connection for the process lifetime
        config.setIdleTimeout(0);
        config.setMaxLifetime(0);
        config.setPoolName("text2sql-sqlite");
        return new HikariDataSource(config);
    }

    static String resolveDatabasePath(Environment environment) {
        String path = environment.getProperty("text2sql.datasource.path");
        if (path == null || path.isBlank()) {
            path = environment.getProperty("TEXT2SQL_DB_PATH");
        }
        if (path == null || path.isBlank()) {
            path = DEFAULT_DATABASE_PATH;
        }
        return Path.of(path.trim()).toAbsolutePath().normalize().toString();
    }
}
