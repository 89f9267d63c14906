package com.coursegen.core.persistence;

import com.coursegen.core.model.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link RunStateStore} that keeps one JSON row per run in PostgreSQL.
 * <p>
 * The table {@code coursegen_run_state} is created automatically via {@link #createTables()}.
 */
public class JdbcRunStateStore implements RunStateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunStateStore.class);

    private static final String TABLE_NAME = "coursegen_run_state";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                run_id            VARCHAR(255) NOT NULL PRIMARY KEY,
                revision          INTEGER NOT NULL,
                completion_status VARCHAR(32) NOT NULL,
                state             TEXT NOT NULL,
                updated_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (run_id, revision, completion_status, state)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (run_id)
            DO UPDATE SET revision = EXCLUDED.revision,
                          completion_status = EXCLUDED.completion_status,
                          state = EXCLUDED.state,
                          updated_at = CURRENT_TIMESTAMP
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT state FROM %s WHERE run_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcRunStateStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the run state table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Run state table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void save(RunState state) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, state.runId());
            stmt.setInt(2, state.revision());
            stmt.setString(3, state.completionStatus().name());
            stmt.setString(4, RunStateJson.write(state));
            stmt.executeUpdate();
            log.debug("Saved run state for {}", state.runId());
        } catch (SQLException e) {
            throw new RunStateStoreException("Failed to save run state " + state.runId(), e);
        }
    }

    @Override
    public Optional<RunState> find(String runId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(RunStateJson.read(rs.getString("state")));
                }
            }
        } catch (SQLException e) {
            throw new RunStateStoreException("Failed to load run state " + runId, e);
        }
        return Optional.empty();
    }
}
