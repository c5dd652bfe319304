package assetguard.db;

import assetguard.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the HikariCP pool for one session. Each session creates its own instance and passes it
 * to the DAOs, so there is no process-wide connection state.
 */
public class DatabaseConnection implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);
    private static final String SCHEMA_RESOURCE = "/schema.sql";

    private final HikariDataSource dataSource;

    public DatabaseConnection(AppConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setJdbcUrl(config.getDatabaseUrl());
        hikariConfig.setUsername(config.getDatabaseUser());
        hikariConfig.setPassword(config.getDatabasePassword());

        hikariConfig.setMaximumPoolSize(config.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(15000);
        hikariConfig.setIdleTimeout(600000);
        hikariConfig.setMaxLifetime(1800000);

        this.dataSource = new HikariDataSource(hikariConfig);
        logger.info("HikariCP connection pool initialized for {}", config.getDatabaseUrl());
    }

    public Connection getInventoryConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Creates the tables from {@code schema.sql}. Statements are idempotent, so calling this on an
     * existing database is harmless.
     */
    public void initializeSchema() throws SQLException, IOException {
        String script;
        try (InputStream input = DatabaseConnection.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (input == null) {
                throw new IOException("Unable to find schema.sql in resources.");
            }
            script = new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }

        int executed = 0;
        try (Connection conn = getInventoryConnection(); Statement stmt = conn.createStatement()) {
            for (String statement : script.split(";")) {
                if (!statement.isBlank()) {
                    stmt.execute(statement.trim());
                    executed++;
                }
            }
        }
        logger.info("Schema initialized ({} statements).", executed);
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            logger.info("HikariCP connection pool closed.");
        }
    }
}
