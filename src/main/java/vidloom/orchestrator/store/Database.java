package vidloom.orchestrator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import vidloom.orchestrator.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with autoCommit off.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(OrchestratorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("vidloom-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                  VARCHAR(64) PRIMARY KEY,
                            owner_id            VARCHAR(64),
                            name                VARCHAR(255) NOT NULL,
                            status              VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            progress_percentage INT DEFAULT 0 NOT NULL,
                            current_step        VARCHAR(255),
                            error_message       CLOB,
                            marked_as_read      BOOLEAN DEFAULT FALSE NOT NULL,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at          TIMESTAMP,
                            completed_at        TIMESTAMP
                        );
                    """);

            // ---------- PARAMETERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_parameters (
                            job_id          VARCHAR(64) PRIMARY KEY REFERENCES jobs(id) ON DELETE CASCADE,
                            prompt          CLOB NOT NULL,
                            negative_prompt CLOB,
                            width           INT NOT NULL,
                            height          INT NOT NULL,
                            video_length    INT NOT NULL,
                            fps             INT NOT NULL,
                            base_model      VARCHAR(100) NOT NULL,
                            motion_adapter  VARCHAR(200),
                            loras           CLOB,
                            inference_steps INT NOT NULL,
                            guidance_scale  DOUBLE NOT NULL,
                            seed            BIGINT NOT NULL,
                            output_format   VARCHAR(10) NOT NULL
                        );
                    """);

            // ---------- RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_results (
                            job_id      VARCHAR(64) PRIMARY KEY REFERENCES jobs(id) ON DELETE CASCADE,
                            object_key  VARCHAR(1024) NOT NULL,
                            bucket      VARCHAR(255) NOT NULL,
                            size_bytes  BIGINT NOT NULL,
                            created_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_owner_read ON jobs(owner_id, marked_as_read);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_created ON jobs(created_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
