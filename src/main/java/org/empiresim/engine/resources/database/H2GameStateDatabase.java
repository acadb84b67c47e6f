package org.empiresim.engine.resources.database;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.empiresim.engine.api.players.PlayerTickState;
import org.empiresim.engine.api.players.SystemState;
import org.empiresim.engine.api.resources.database.IOfflineSnapshotStore;
import org.empiresim.engine.api.resources.database.IPlayerTickStateStore;
import org.empiresim.engine.api.resources.database.ITickRecordStore;
import org.empiresim.engine.api.ticks.TickNotFoundException;
import org.empiresim.engine.api.ticks.TickRecord;
import org.empiresim.engine.api.ticks.TickResult;
import org.empiresim.engine.api.ticks.TickStatus;
import org.empiresim.engine.api.ticks.TriggerSource;
import org.empiresim.runtime.model.GameTime;
import org.empiresim.runtime.offline.AutopilotStrategy;
import org.empiresim.runtime.offline.OfflineSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * H2 implementation of all game state stores using HikariCP for connection pooling.
 * <p>
 * The single-running-tick rule is enforced by a unique {@code running_slot} column that holds
 * {@code 1} while a tick runs and {@code NULL} afterwards. Per-player updates lock the player row
 * with {@code SELECT ... FOR UPDATE}. Timestamps are stored as epoch milliseconds.
 */
public class H2GameStateDatabase extends AbstractDatabaseResource
    implements ITickRecordStore, IPlayerTickStateStore, IOfflineSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(H2GameStateDatabase.class);

    private static final Type SYSTEMS_TYPE = new TypeToken<Map<String, SystemState>>() { }.getType();
    private static final Type PROCESSORS_TYPE = new TypeToken<List<String>>() { }.getType();

    private static final String TICK_COLUMNS = "tick_id, total_months, triggered_by, triggered_by_user_id, "
        + "started_at, completed_at, duration_ms, status, success, processors_run, total_items, total_errors, "
        + "result_json, failure_reason";

    private final HikariDataSource dataSource;
    private final Gson gson;

    public H2GameStateDatabase(String name, Config options) {
        super(name, options);

        final String jdbcUrl = getJdbcUrl(options);
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("H2 database '{}' connection pool started (max={}, minIdle={})",
                name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";
            String errorMsg;
            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                errorMsg = String.format(
                    "Cannot open H2 database '%s': file already in use by another process. File: %s.mv.db",
                    name, jdbcUrl.replace("jdbc:h2:", ""));
            } else {
                errorMsg = String.format("Failed to initialize H2 database '%s': %s. Database: %s. Error: %s",
                    name, cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
            }
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }

        this.gson = new GsonBuilder()
            .registerTypeAdapter(Instant.class, new InstantAdapter())
            .create();

        try {
            createSchema();
        } catch (SQLException e) {
            dataSource.close();
            String errorMsg = String.format("Failed to create schema of H2 database '%s': %s", name, e.getMessage());
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }
    }

    private static String getJdbcUrl(Config options) {
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for H2GameStateDatabase.");
        }
        return options.getString("jdbcUrl");
    }

    private void createSchema() throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            H2SchemaUtil.executeDdlIfNotExists(stmt,
                "CREATE TABLE IF NOT EXISTS tick_records ("
                    + "tick_id VARCHAR(128) PRIMARY KEY, "
                    + "total_months INT NOT NULL, "
                    + "triggered_by VARCHAR(16) NOT NULL, "
                    + "triggered_by_user_id VARCHAR(128), "
                    + "started_at BIGINT NOT NULL, "
                    + "completed_at BIGINT, "
                    + "duration_ms BIGINT, "
                    + "status VARCHAR(16) NOT NULL, "
                    + "success BOOLEAN NOT NULL, "
                    + "processors_run VARCHAR(4096), "
                    + "total_items INT NOT NULL, "
                    + "total_errors INT NOT NULL, "
                    + "result_json CLOB, "
                    + "failure_reason VARCHAR(1024), "
                    + "running_slot INT UNIQUE)",
                "tick_records");
            H2SchemaUtil.executeDdlIfNotExists(stmt,
                "CREATE INDEX IF NOT EXISTS idx_tick_records_status ON tick_records (status, total_months)",
                "idx_tick_records_status");
            H2SchemaUtil.executeDdlIfNotExists(stmt,
                "CREATE TABLE IF NOT EXISTS player_tick_state ("
                    + "player_id VARCHAR(128) PRIMARY KEY, "
                    + "last_total_months INT NOT NULL, "
                    + "last_processed_at BIGINT, "
                    + "systems_json CLOB NOT NULL)",
                "player_tick_state");
            H2SchemaUtil.executeDdlIfNotExists(stmt,
                "CREATE INDEX IF NOT EXISTS idx_player_tick_state_last ON player_tick_state (last_total_months)",
                "idx_player_tick_state_last");
            H2SchemaUtil.executeDdlIfNotExists(stmt,
                "CREATE TABLE IF NOT EXISTS offline_snapshots ("
                    + "player_id VARCHAR(128) PRIMARY KEY, "
                    + "captured_at_week BIGINT NOT NULL, "
                    + "captured_at BIGINT NOT NULL, "
                    + "influence DOUBLE PRECISION NOT NULL, "
                    + "approval_rating DOUBLE PRECISION, "
                    + "autopilot VARCHAR(16) NOT NULL)",
                "offline_snapshots");
        }
    }

    // ========== Tick records ==========

    @Override
    public boolean insertRunning(TickRecord record) {
        if (!record.isRunning()) {
            throw new IllegalArgumentException("Only RUNNING records can be inserted, got " + record.status());
        }
        String sql = "INSERT INTO tick_records (" + TICK_COLUMNS + ", running_slot) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1)";
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            bindTickRecord(ps, record);
            ps.executeUpdate();
            queriesExecuted.incrementAndGet();
            rowsWritten.incrementAndGet();
            return true;
        } catch (SQLException e) {
            if (H2SchemaUtil.isIntegrityViolation(e)) {
                log.debug("Insert of tick '{}' rejected: {}", record.tickId(), e.getMessage());
                return false;
            }
            throw writeFailed("INSERT_TICK_FAILED", "Failed to insert tick " + record.tickId(), e);
        }
    }

    @Override
    public TickRecord finish(String tickId, TickStatus status, TickResult result, String reason, Instant completedAt)
        throws TickNotFoundException {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            TickRecord existing;
            try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + TICK_COLUMNS + " FROM tick_records WHERE tick_id = ? FOR UPDATE")) {
                ps.setString(1, tickId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        conn.rollback();
                        throw new TickNotFoundException(tickId);
                    }
                    existing = mapTickRecord(rs);
                }
            }
            TickRecord finished;
            try {
                finished = existing.finish(status, result, reason, completedAt);
            } catch (RuntimeException e) {
                conn.rollback();
                throw e;
            }
            try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE tick_records SET completed_at = ?, duration_ms = ?, status = ?, success = ?, "
                    + "processors_run = ?, total_items = ?, total_errors = ?, result_json = ?, failure_reason = ?, "
                    + "running_slot = NULL WHERE tick_id = ?")) {
                ps.setLong(1, finished.completedAt().toEpochMilli());
                ps.setLong(2, finished.durationMs());
                ps.setString(3, finished.status().name());
                ps.setBoolean(4, finished.success());
                ps.setString(5, gson.toJson(finished.processorsRun()));
                ps.setInt(6, finished.totalItemsProcessed());
                ps.setInt(7, finished.totalErrors());
                ps.setString(8, finished.result() == null ? null : gson.toJson(finished.result()));
                ps.setString(9, finished.failureReason());
                ps.setString(10, tickId);
                ps.executeUpdate();
            }
            conn.commit();
            queriesExecuted.addAndGet(2);
            rowsWritten.incrementAndGet();
            return finished;
        } catch (SQLException e) {
            rollbackQuietly(conn);
            throw writeFailed("FINISH_TICK_FAILED", "Failed to finish tick " + tickId, e);
        } finally {
            closeQuietly(conn);
        }
    }

    @Override
    public Optional<TickRecord> findById(String tickId) {
        return querySingleTick("SELECT " + TICK_COLUMNS + " FROM tick_records WHERE tick_id = ?", tickId);
    }

    @Override
    public Optional<TickRecord> findRunning() {
        return querySingleTick("SELECT " + TICK_COLUMNS + " FROM tick_records WHERE running_slot = 1", null);
    }

    @Override
    public Optional<TickRecord> findLatestCompleted() {
        return querySingleTick("SELECT " + TICK_COLUMNS + " FROM tick_records WHERE status = 'COMPLETED' "
            + "ORDER BY total_months DESC, started_at DESC LIMIT 1", null);
    }

    @Override
    public Optional<TickRecord> findLatestScheduled() {
        return querySingleTick("SELECT " + TICK_COLUMNS + " FROM tick_records WHERE status = 'COMPLETED' "
            + "AND triggered_by IN ('SCHEDULED', 'CATCHUP') ORDER BY total_months DESC, started_at DESC LIMIT 1", null);
    }

    @Override
    public List<TickRecord> findRecent(int limit) {
        List<TickRecord> records = new ArrayList<>();
        if (limit <= 0) {
            return records;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "SELECT " + TICK_COLUMNS + " FROM tick_records ORDER BY started_at DESC, tick_id DESC LIMIT ?")) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapTickRecord(rs));
                }
            }
            queriesExecuted.incrementAndGet();
            return records;
        } catch (SQLException e) {
            throw readFailed("Failed to read recent ticks", e);
        }
    }

    @Override
    public long countByStatus(TickStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM tick_records WHERE status = ?")) {
            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                queriesExecuted.incrementAndGet();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw readFailed("Failed to count ticks with status " + status, e);
        }
    }

    private Optional<TickRecord> querySingleTick(String sql, String param) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            if (param != null) {
                ps.setString(1, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                queriesExecuted.incrementAndGet();
                return rs.next() ? Optional.of(mapTickRecord(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw readFailed("Failed to read tick record", e);
        }
    }

    private void bindTickRecord(PreparedStatement ps, TickRecord record) throws SQLException {
        ps.setString(1, record.tickId());
        ps.setInt(2, record.gameTime().totalMonths());
        ps.setString(3, record.triggeredBy().name());
        ps.setString(4, record.triggeredByUserId());
        ps.setLong(5, record.startedAt().toEpochMilli());
        setNullableLong(ps, 6, record.completedAt() == null ? null : record.completedAt().toEpochMilli());
        setNullableLong(ps, 7, record.durationMs());
        ps.setString(8, record.status().name());
        ps.setBoolean(9, record.success());
        ps.setString(10, gson.toJson(record.processorsRun()));
        ps.setInt(11, record.totalItemsProcessed());
        ps.setInt(12, record.totalErrors());
        ps.setString(13, record.result() == null ? null : gson.toJson(record.result()));
        ps.setString(14, record.failureReason());
    }

    private TickRecord mapTickRecord(ResultSet rs) throws SQLException {
        long completedAt = rs.getLong("completed_at");
        Instant completed = rs.wasNull() ? null : Instant.ofEpochMilli(completedAt);
        long duration = rs.getLong("duration_ms");
        Long durationMs = rs.wasNull() ? null : duration;
        String processorsJson = rs.getString("processors_run");
        List<String> processors = processorsJson == null ? List.of() : gson.fromJson(processorsJson, PROCESSORS_TYPE);
        String resultJson = rs.getString("result_json");
        return new TickRecord(
            rs.getString("tick_id"),
            GameTime.ofTotalMonths(rs.getInt("total_months")),
            TriggerSource.valueOf(rs.getString("triggered_by")),
            rs.getString("triggered_by_user_id"),
            Instant.ofEpochMilli(rs.getLong("started_at")),
            completed,
            durationMs,
            TickStatus.valueOf(rs.getString("status")),
            rs.getBoolean("success"),
            processors,
            rs.getInt("total_items"),
            rs.getInt("total_errors"),
            resultJson == null ? null : gson.fromJson(resultJson, TickResult.class),
            rs.getString("failure_reason"));
    }

    // ========== Player tick state ==========

    @Override
    public Optional<PlayerTickState> find(String playerId) {
        try (Connection conn = dataSource.getConnection()) {
            queriesExecuted.incrementAndGet();
            return selectPlayer(conn, playerId, false);
        } catch (SQLException e) {
            throw readFailed("Failed to read tick state of player " + playerId, e);
        }
    }

    @Override
    public PlayerTickState getOrCreate(String playerId, Instant now) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            PlayerTickState state = lockOrCreatePlayer(conn, playerId, now);
            conn.commit();
            return state;
        } catch (SQLException e) {
            rollbackQuietly(conn);
            throw writeFailed("CREATE_PLAYER_FAILED", "Failed to create tick state of player " + playerId, e);
        } finally {
            closeQuietly(conn);
        }
    }

    @Override
    public PlayerTickState advance(String playerId, GameTime gameTime, String system,
                                   Map<String, Long> counterIncrements, Instant at) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            PlayerTickState current = lockOrCreatePlayer(conn, playerId, at);
            PlayerTickState next = current.advancedTo(gameTime, system, counterIncrements, at);
            if (next != current) {
                updatePlayer(conn, next);
            }
            conn.commit();
            return next;
        } catch (SQLException e) {
            rollbackQuietly(conn);
            throw writeFailed("ADVANCE_PLAYER_FAILED",
                "Failed to advance player " + playerId + " to " + gameTime + " for " + system, e);
        } finally {
            closeQuietly(conn);
        }
    }

    @Override
    public List<String> findLagging(GameTime gameTime) {
        List<String> lagging = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "SELECT player_id FROM player_tick_state WHERE last_total_months < ? ORDER BY player_id")) {
            ps.setInt(1, gameTime.totalMonths());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    lagging.add(rs.getString(1));
                }
            }
            queriesExecuted.incrementAndGet();
            return lagging;
        } catch (SQLException e) {
            throw readFailed("Failed to find players lagging behind " + gameTime, e);
        }
    }

    @Override
    public int clampAhead(GameTime ceiling, Instant at) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "UPDATE player_tick_state SET last_total_months = ?, last_processed_at = ? WHERE last_total_months > ?")) {
            ps.setInt(1, ceiling.totalMonths());
            ps.setLong(2, at.toEpochMilli());
            ps.setInt(3, ceiling.totalMonths());
            int changed = ps.executeUpdate();
            queriesExecuted.incrementAndGet();
            rowsWritten.addAndGet(changed);
            return changed;
        } catch (SQLException e) {
            throw writeFailed("CLAMP_PLAYERS_FAILED", "Failed to clamp players to " + ceiling, e);
        }
    }

    @Override
    public long count() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM player_tick_state")) {
            rs.next();
            queriesExecuted.incrementAndGet();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw readFailed("Failed to count players", e);
        }
    }

    /**
     * Locks the player row, inserting the initial state first if the player is unknown.
     * A concurrent insert of the same player is tolerated and followed by a locking read.
     */
    private PlayerTickState lockOrCreatePlayer(Connection conn, String playerId, Instant now) throws SQLException {
        Optional<PlayerTickState> existing = selectPlayer(conn, playerId, true);
        if (existing.isPresent()) {
            return existing.get();
        }
        PlayerTickState initial = PlayerTickState.initial(playerId, now);
        try (PreparedStatement ps = conn.prepareStatement(
            "INSERT INTO player_tick_state (player_id, last_total_months, last_processed_at, systems_json) "
                + "VALUES (?, ?, ?, ?)")) {
            ps.setString(1, playerId);
            ps.setInt(2, initial.lastProcessedTick().totalMonths());
            ps.setLong(3, now.toEpochMilli());
            ps.setString(4, gson.toJson(initial.systems(), SYSTEMS_TYPE));
            ps.executeUpdate();
            queriesExecuted.incrementAndGet();
            rowsWritten.incrementAndGet();
            return initial;
        } catch (SQLException e) {
            if (!H2SchemaUtil.isIntegrityViolation(e)) {
                throw e;
            }
            return selectPlayer(conn, playerId, true)
                .orElseThrow(() -> new SQLException("Player " + playerId + " vanished after concurrent insert"));
        }
    }

    private Optional<PlayerTickState> selectPlayer(Connection conn, String playerId, boolean forUpdate)
        throws SQLException {
        String sql = "SELECT player_id, last_total_months, last_processed_at, systems_json "
            + "FROM player_tick_state WHERE player_id = ?" + (forUpdate ? " FOR UPDATE" : "");
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, playerId);
            try (ResultSet rs = ps.executeQuery()) {
                queriesExecuted.incrementAndGet();
                if (!rs.next()) {
                    return Optional.empty();
                }
                long lastAt = rs.getLong("last_processed_at");
                Instant lastProcessedAt = rs.wasNull() ? null : Instant.ofEpochMilli(lastAt);
                Map<String, SystemState> systems = gson.fromJson(rs.getString("systems_json"), SYSTEMS_TYPE);
                return Optional.of(new PlayerTickState(
                    rs.getString("player_id"),
                    GameTime.ofTotalMonths(rs.getInt("last_total_months")),
                    lastProcessedAt,
                    systems));
            }
        }
    }

    private void updatePlayer(Connection conn, PlayerTickState state) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
            "UPDATE player_tick_state SET last_total_months = ?, last_processed_at = ?, systems_json = ? "
                + "WHERE player_id = ?")) {
            ps.setInt(1, state.lastProcessedTick().totalMonths());
            setNullableLong(ps, 2, state.lastProcessedAt() == null ? null : state.lastProcessedAt().toEpochMilli());
            ps.setString(3, gson.toJson(state.systems(), SYSTEMS_TYPE));
            ps.setString(4, state.playerId());
            ps.executeUpdate();
            queriesExecuted.incrementAndGet();
            rowsWritten.incrementAndGet();
        }
    }

    // ========== Offline snapshots ==========

    @Override
    public void save(OfflineSnapshot snapshot) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "MERGE INTO offline_snapshots (player_id, captured_at_week, captured_at, influence, approval_rating, autopilot) "
                     + "KEY (player_id) VALUES (?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, snapshot.playerId());
            ps.setLong(2, snapshot.capturedAtWeek());
            ps.setLong(3, snapshot.capturedAt().toEpochMilli());
            ps.setDouble(4, snapshot.influence());
            if (snapshot.approvalRating() == null) {
                ps.setNull(5, Types.DOUBLE);
            } else {
                ps.setDouble(5, snapshot.approvalRating());
            }
            ps.setString(6, snapshot.autopilotStrategy().name());
            ps.executeUpdate();
            queriesExecuted.incrementAndGet();
            rowsWritten.incrementAndGet();
        } catch (SQLException e) {
            throw writeFailed("SAVE_SNAPSHOT_FAILED", "Failed to save offline snapshot of " + snapshot.playerId(), e);
        }
    }

    @Override
    public Optional<OfflineSnapshot> consume(String playerId) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            Optional<OfflineSnapshot> snapshot = selectSnapshot(conn, playerId, true);
            if (snapshot.isPresent()) {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM offline_snapshots WHERE player_id = ?")) {
                    ps.setString(1, playerId);
                    ps.executeUpdate();
                    queriesExecuted.incrementAndGet();
                }
            }
            conn.commit();
            return snapshot;
        } catch (SQLException e) {
            rollbackQuietly(conn);
            throw writeFailed("CONSUME_SNAPSHOT_FAILED", "Failed to consume offline snapshot of " + playerId, e);
        } finally {
            closeQuietly(conn);
        }
    }

    @Override
    public Optional<OfflineSnapshot> peek(String playerId) {
        try (Connection conn = dataSource.getConnection()) {
            return selectSnapshot(conn, playerId, false);
        } catch (SQLException e) {
            throw readFailed("Failed to read offline snapshot of " + playerId, e);
        }
    }

    private Optional<OfflineSnapshot> selectSnapshot(Connection conn, String playerId, boolean forUpdate)
        throws SQLException {
        String sql = "SELECT player_id, captured_at_week, captured_at, influence, approval_rating, autopilot "
            + "FROM offline_snapshots WHERE player_id = ?" + (forUpdate ? " FOR UPDATE" : "");
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, playerId);
            try (ResultSet rs = ps.executeQuery()) {
                queriesExecuted.incrementAndGet();
                if (!rs.next()) {
                    return Optional.empty();
                }
                double approval = rs.getDouble("approval_rating");
                Double approvalRating = rs.wasNull() ? null : approval;
                return Optional.of(new OfflineSnapshot(
                    rs.getString("player_id"),
                    rs.getLong("captured_at_week"),
                    Instant.ofEpochMilli(rs.getLong("captured_at")),
                    rs.getDouble("influence"),
                    approvalRating,
                    AutopilotStrategy.valueOf(rs.getString("autopilot"))));
            }
        }
    }

    // ========== Helpers ==========

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    private RuntimeException writeFailed(String code, String message, SQLException e) {
        writeErrors.incrementAndGet();
        log.warn("{} in database '{}': {}", message, resourceName, e.getMessage());
        log.debug("Stack trace:", e);
        recordError(code, message, "SQLState: " + e.getSQLState() + ", Error: " + e.getMessage());
        return new RuntimeException(message, e);
    }

    private RuntimeException readFailed(String message, SQLException e) {
        readErrors.incrementAndGet();
        log.warn("{} in database '{}': {}", message, resourceName, e.getMessage());
        log.debug("Stack trace:", e);
        recordError("READ_FAILED", message, "SQLState: " + e.getSQLState() + ", Error: " + e.getMessage());
        return new RuntimeException(message, e);
    }

    private void rollbackQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.debug("Rollback failed (connection may be closed): {}", rollbackEx.getMessage());
        }
    }

    private void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.setAutoCommit(true);
            conn.close();
        } catch (SQLException closeEx) {
            log.debug("Closing connection failed: {}", closeEx.getMessage());
        }
    }

    @Override
    protected void closeConnectionPool() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.debug("H2 database '{}' connection pool closed", resourceName);
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        if (dataSource != null && !dataSource.isClosed() && dataSource.getHikariPoolMXBean() != null) {
            metrics.put("h2_pool_active_connections", dataSource.getHikariPoolMXBean().getActiveConnections());
            metrics.put("h2_pool_idle_connections", dataSource.getHikariPoolMXBean().getIdleConnections());
        }
    }

    /**
     * Serializes instants as ISO-8601 strings.
     */
    private static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.toString());
            }
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return Instant.parse(in.nextString());
        }
    }
}
