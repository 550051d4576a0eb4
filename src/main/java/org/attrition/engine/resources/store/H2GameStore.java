package org.attrition.engine.resources.store;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.attrition.engine.api.store.IGameStore;
import org.attrition.engine.api.store.IdentityConflictException;
import org.attrition.engine.api.store.StoreException;
import org.attrition.engine.model.BaseRecord;
import org.attrition.engine.model.Empire;
import org.attrition.engine.model.Location;
import org.attrition.engine.model.QueueEntry;
import org.attrition.engine.model.QueueStatus;
import org.attrition.engine.model.QueueType;
import org.attrition.engine.model.RecordKind;
import org.attrition.engine.resources.AbstractResource;
import org.attrition.engine.utils.H2SchemaUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * H2 implementation of {@link IGameStore} using HikariCP for connection pooling.
 * <p>
 * Uniqueness among live items is enforced by nullable unique columns that are only set
 * while an item is in flight ({@code queue_entries.live_identity}, {@code base_records.lane_slot})
 * and by the natural key of {@code base_records}. All other invariants rely on conditional
 * updates; see the method docs of {@link IGameStore}.
 * <p>
 * Implements {@link AutoCloseable} to release the connection pool during shutdown.
 */
public class H2GameStore extends AbstractResource implements IGameStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(H2GameStore.class);

    private static final String RECORD_COLUMNS =
        "id, kind, empire_id, location_coord, catalog_key, level, is_active, pending_upgrade, credits_cost, "
            + "admission_order, identity_key, construction_started, construction_completed, created_at";

    private static final String ENTRY_COLUMNS =
        "id, queue_type, empire_id, location_coord, catalog_key, level, quantity, identity_key, status, charged, "
            + "credits_cost, created_at, started_at, completes_at";

    private final HikariDataSource dataSource;
    private final AtomicLong statementsExecuted = new AtomicLong(0);
    private final AtomicLong identityConflicts = new AtomicLong(0);
    private final AtomicLong laneConflicts = new AtomicLong(0);

    public H2GameStore(String name, Config options) {
        super(name, options);

        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("Store '" + name + "' requires a 'jdbcUrl' option.");
        }
        final String jdbcUrl = options.getString("jdbcUrl");

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setUsername(options.hasPath("username") ? options.getString("username") : "sa");
        hikariConfig.setPassword(options.hasPath("password") ? options.getString("password") : "");
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
            log.debug("H2 store '{}' connection pool started (max={}, minIdle={})",
                name, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String errorMsg = String.format("Failed to initialize H2 store '%s': %s. Database: %s. Error: %s",
                name, cause.getClass().getSimpleName(), jdbcUrl, cause.getMessage());
            log.error(errorMsg);
            throw new StoreException(errorMsg, e);
        }

        try {
            createSchema();
        } catch (SQLException e) {
            dataSource.close();
            log.error("Failed to create schema for H2 store '{}': {}", name, e.getMessage());
            throw new StoreException("Schema creation failed for store '" + name + "'", e);
        }
    }

    private void createSchema() throws SQLException {
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            H2SchemaUtil.executeTableCreation(st,
                "CREATE TABLE IF NOT EXISTS empires ("
                    + "id VARCHAR(64) PRIMARY KEY, "
                    + "name VARCHAR(255) NOT NULL, "
                    + "credits BIGINT NOT NULL DEFAULT 0 CHECK (credits >= 0), "
                    + "last_income_at TIMESTAMP(9) WITH TIME ZONE NOT NULL)",
                "empires");
            H2SchemaUtil.executeTableCreation(st,
                "CREATE TABLE IF NOT EXISTS empire_tech_levels ("
                    + "empire_id VARCHAR(64) NOT NULL, "
                    + "tech_key VARCHAR(64) NOT NULL, "
                    + "level INT NOT NULL, "
                    + "PRIMARY KEY (empire_id, tech_key))",
                "empire_tech_levels");
            H2SchemaUtil.executeTableCreation(st,
                "CREATE TABLE IF NOT EXISTS empire_units ("
                    + "empire_id VARCHAR(64) NOT NULL, "
                    + "location_coord VARCHAR(64) NOT NULL, "
                    + "unit_key VARCHAR(64) NOT NULL, "
                    + "unit_count BIGINT NOT NULL, "
                    + "PRIMARY KEY (empire_id, location_coord, unit_key))",
                "empire_units");
            H2SchemaUtil.executeTableCreation(st,
                "CREATE TABLE IF NOT EXISTS locations ("
                    + "coord VARCHAR(64) PRIMARY KEY, "
                    + "owner_empire_id VARCHAR(64), "
                    + "solar_energy INT NOT NULL, "
                    + "gas_yield INT NOT NULL, "
                    + "fertility INT NOT NULL, "
                    + "metal_yield INT NOT NULL, "
                    + "area INT NOT NULL)",
                "locations");
            H2SchemaUtil.executeTableCreation(st,
                "CREATE SEQUENCE IF NOT EXISTS admission_order_seq START WITH 1",
                "admission_order_seq");
            H2SchemaUtil.executeTableCreation(st,
                "CREATE TABLE IF NOT EXISTS base_records ("
                    + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                    + "kind VARCHAR(16) NOT NULL, "
                    + "empire_id VARCHAR(64) NOT NULL, "
                    + "location_coord VARCHAR(64) NOT NULL, "
                    + "catalog_key VARCHAR(64) NOT NULL, "
                    + "level INT NOT NULL, "
                    + "is_active BOOLEAN NOT NULL, "
                    + "pending_upgrade BOOLEAN NOT NULL, "
                    + "credits_cost BIGINT NOT NULL DEFAULT 0, "
                    + "admission_order BIGINT NOT NULL DEFAULT 0, "
                    + "identity_key VARCHAR(255), "
                    + "lane_slot VARCHAR(255), "
                    + "construction_started TIMESTAMP(9) WITH TIME ZONE, "
                    + "construction_completed TIMESTAMP(9) WITH TIME ZONE, "
                    + "created_at TIMESTAMP(9) WITH TIME ZONE NOT NULL, "
                    + "CONSTRAINT uq_base_records_identity UNIQUE (empire_id, location_coord, kind, catalog_key), "
                    + "CONSTRAINT uq_base_records_lane UNIQUE (lane_slot))",
                "base_records");
            H2SchemaUtil.executeTableCreation(st,
                "CREATE TABLE IF NOT EXISTS queue_entries ("
                    + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                    + "queue_type VARCHAR(16) NOT NULL, "
                    + "empire_id VARCHAR(64) NOT NULL, "
                    + "location_coord VARCHAR(64) NOT NULL, "
                    + "catalog_key VARCHAR(64) NOT NULL, "
                    + "level INT NOT NULL, "
                    + "quantity INT NOT NULL, "
                    + "identity_key VARCHAR(255) NOT NULL, "
                    + "live_identity VARCHAR(255), "
                    + "status VARCHAR(16) NOT NULL, "
                    + "charged BOOLEAN NOT NULL, "
                    + "credits_cost BIGINT NOT NULL, "
                    + "created_at TIMESTAMP(9) WITH TIME ZONE NOT NULL, "
                    + "started_at TIMESTAMP(9) WITH TIME ZONE, "
                    + "completes_at TIMESTAMP(9) WITH TIME ZONE, "
                    + "CONSTRAINT uq_queue_entries_live UNIQUE (live_identity))",
                "queue_entries");
            H2SchemaUtil.executeTableCreation(st,
                "CREATE INDEX IF NOT EXISTS idx_queue_entries_due ON queue_entries (queue_type, status, completes_at)",
                "idx_queue_entries_due");
            H2SchemaUtil.executeTableCreation(st,
                "CREATE INDEX IF NOT EXISTS idx_base_records_due ON base_records (is_active, construction_completed)",
                "idx_base_records_due");
        }
        log.debug("H2 store '{}' schema ready", resourceName);
    }

    // Empires

    @Override
    public Optional<Empire> findEmpire(String empireId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "SELECT id, name, credits, last_income_at FROM empires WHERE id = ?")) {
            ps.setString(1, empireId);
            statementsExecuted.incrementAndGet();
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapEmpire(rs, loadTechLevels(conn, empireId)));
            }
        } catch (SQLException e) {
            throw failure("findEmpire", e);
        }
    }

    @Override
    public List<Empire> listEmpires() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "SELECT id, name, credits, last_income_at FROM empires ORDER BY id")) {
            statementsExecuted.incrementAndGet();
            List<Empire> empires = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    empires.add(mapEmpire(rs, loadTechLevels(conn, rs.getString("id"))));
                }
            }
            return empires;
        } catch (SQLException e) {
            throw failure("listEmpires", e);
        }
    }

    private Map<String, Integer> loadTechLevels(Connection conn, String empireId) throws SQLException {
        Map<String, Integer> levels = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(
            "SELECT tech_key, level FROM empire_tech_levels WHERE empire_id = ?")) {
            ps.setString(1, empireId);
            statementsExecuted.incrementAndGet();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    levels.put(rs.getString("tech_key"), rs.getInt("level"));
                }
            }
        }
        return levels;
    }

    private Empire mapEmpire(ResultSet rs, Map<String, Integer> techLevels) throws SQLException {
        return new Empire(rs.getString("id"), rs.getString("name"), rs.getLong("credits"),
            techLevels, getInstant(rs, "last_income_at"));
    }

    @Override
    public void saveEmpire(Empire empire) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement ps = conn.prepareStatement(
                    "MERGE INTO empires (id, name, credits, last_income_at) KEY (id) VALUES (?, ?, ?, ?)")) {
                    ps.setString(1, empire.id());
                    ps.setString(2, empire.name());
                    ps.setLong(3, empire.credits());
                    setInstant(ps, 4, empire.lastIncomeAt());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(
                    "DELETE FROM empire_tech_levels WHERE empire_id = ?")) {
                    ps.setString(1, empire.id());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO empire_tech_levels (empire_id, tech_key, level) VALUES (?, ?, ?)")) {
                    for (Map.Entry<String, Integer> tech : empire.techLevels().entrySet()) {
                        ps.setString(1, empire.id());
                        ps.setString(2, tech.getKey());
                        ps.setInt(3, tech.getValue());
                        ps.addBatch();
                    }
                    ps.executeBatch();
                }
                statementsExecuted.addAndGet(3);
                conn.commit();
            } catch (SQLException e) {
                rollback(conn, "saveEmpire");
                throw e;
            }
        } catch (SQLException e) {
            throw failure("saveEmpire", e);
        }
    }

    @Override
    public boolean debitCredits(String empireId, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Debit amount must not be negative: " + amount);
        }
        return executeUpdate("debitCredits",
            "UPDATE empires SET credits = credits - ? WHERE id = ? AND credits >= ?",
            ps -> {
                ps.setLong(1, amount);
                ps.setString(2, empireId);
                ps.setLong(3, amount);
            }) == 1;
    }

    @Override
    public void addCredits(String empireId, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Credit amount must not be negative: " + amount);
        }
        executeUpdate("addCredits", "UPDATE empires SET credits = credits + ? WHERE id = ?", ps -> {
            ps.setLong(1, amount);
            ps.setString(2, empireId);
        });
    }

    @Override
    public boolean accrueIncome(String empireId, long amount, Instant expectedLastIncomeAt, Instant newLastIncomeAt) {
        return executeUpdate("accrueIncome",
            "UPDATE empires SET credits = credits + ?, last_income_at = ? WHERE id = ? AND last_income_at = ?",
            ps -> {
                ps.setLong(1, amount);
                setInstant(ps, 2, newLastIncomeAt);
                ps.setString(3, empireId);
                setInstant(ps, 4, expectedLastIncomeAt);
            }) == 1;
    }

    @Override
    public Map<String, Long> findUnitCounts(String empireId, String coord) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "SELECT unit_key, unit_count FROM empire_units WHERE empire_id = ? AND location_coord = ? ORDER BY unit_key")) {
            ps.setString(1, empireId);
            ps.setString(2, coord);
            statementsExecuted.incrementAndGet();
            Map<String, Long> counts = new LinkedHashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(rs.getString("unit_key"), rs.getLong("unit_count"));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw failure("findUnitCounts", e);
        }
    }

    // Locations

    @Override
    public Optional<Location> findLocation(String coord) {
        List<Location> found = queryLocations("SELECT * FROM locations WHERE coord = ?", coord);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<Location> findLocationsOwnedBy(String empireId) {
        return queryLocations("SELECT * FROM locations WHERE owner_empire_id = ? ORDER BY coord", empireId);
    }

    private List<Location> queryLocations(String sql, String param) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, param);
            statementsExecuted.incrementAndGet();
            List<Location> locations = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    locations.add(new Location(rs.getString("coord"), rs.getString("owner_empire_id"),
                        rs.getInt("solar_energy"), rs.getInt("gas_yield"), rs.getInt("fertility"),
                        rs.getInt("metal_yield"), rs.getInt("area")));
                }
            }
            return locations;
        } catch (SQLException e) {
            throw failure("queryLocations", e);
        }
    }

    @Override
    public void saveLocation(Location location) {
        executeUpdate("saveLocation",
            "MERGE INTO locations (coord, owner_empire_id, solar_energy, gas_yield, fertility, metal_yield, area) "
                + "KEY (coord) VALUES (?, ?, ?, ?, ?, ?, ?)",
            ps -> {
                ps.setString(1, location.coord());
                ps.setString(2, location.ownerEmpireId());
                ps.setInt(3, location.solarEnergy());
                ps.setInt(4, location.gasYield());
                ps.setInt(5, location.fertility());
                ps.setInt(6, location.metalYield());
                ps.setInt(7, location.area());
            });
    }

    // Base records

    @Override
    public List<BaseRecord> findRecords(String empireId, String coord) {
        return queryRecords("SELECT " + RECORD_COLUMNS + " FROM base_records "
            + "WHERE empire_id = ? AND location_coord = ? ORDER BY kind, catalog_key", ps -> {
                ps.setString(1, empireId);
                ps.setString(2, coord);
            });
    }

    @Override
    public Optional<BaseRecord> findRecord(long id) {
        return first(queryRecords("SELECT " + RECORD_COLUMNS + " FROM base_records WHERE id = ?",
            ps -> ps.setLong(1, id)));
    }

    @Override
    public Optional<BaseRecord> findRecord(String empireId, String coord, RecordKind kind, String catalogKey) {
        return first(queryRecords("SELECT " + RECORD_COLUMNS + " FROM base_records "
            + "WHERE empire_id = ? AND location_coord = ? AND kind = ? AND catalog_key = ?", ps -> {
                ps.setString(1, empireId);
                ps.setString(2, coord);
                ps.setString(3, kind.name());
                ps.setString(4, catalogKey);
            }));
    }

    @Override
    public void seedRecord(String empireId, String coord, RecordKind kind, String catalogKey, int level) {
        try {
            executeUpdate("seedRecord",
                "INSERT INTO base_records (kind, empire_id, location_coord, catalog_key, level, is_active, "
                    + "pending_upgrade, created_at) VALUES (?, ?, ?, ?, ?, TRUE, FALSE, ?)",
                ps -> {
                    ps.setString(1, kind.name());
                    ps.setString(2, empireId);
                    ps.setString(3, coord);
                    ps.setString(4, catalogKey);
                    ps.setInt(5, level);
                    setInstant(ps, 6, Instant.now());
                });
        } catch (IdentityConflictException e) {
            log.debug("Record {} at {} already exists, seed ignored", catalogKey, coord);
        }
    }

    @Override
    public BaseRecord insertConstruction(RecordKind kind, String empireId, String coord, String catalogKey,
                                         long creditsCost, String identityKey) {
        try (Connection conn = dataSource.getConnection()) {
            long order = nextAdmissionOrder(conn);
            long id;
            try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO base_records (kind, empire_id, location_coord, catalog_key, level, is_active, "
                    + "pending_upgrade, credits_cost, admission_order, identity_key, created_at) "
                    + "VALUES (?, ?, ?, ?, 0, FALSE, FALSE, ?, ?, ?, ?)",
                Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, kind.name());
                ps.setString(2, empireId);
                ps.setString(3, coord);
                ps.setString(4, catalogKey);
                ps.setLong(5, creditsCost);
                ps.setLong(6, order);
                ps.setString(7, identityKey);
                setInstant(ps, 8, Instant.now());
                statementsExecuted.incrementAndGet();
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    keys.next();
                    id = keys.getLong(1);
                }
            }
            return findRecord(id).orElseThrow(() -> new StoreException("Inserted record " + id + " vanished", null));
        } catch (SQLException e) {
            if (H2SchemaUtil.isIdentityRace(e)) {
                identityConflicts.incrementAndGet();
                throw new IdentityConflictException(identityKey, e);
            }
            throw failure("insertConstruction", e);
        }
    }

    @Override
    public BaseRecord beginUpgrade(long recordId, long creditsCost, String identityKey) {
        int updated;
        try (Connection conn = dataSource.getConnection()) {
            long order = nextAdmissionOrder(conn);
            try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE base_records SET is_active = FALSE, pending_upgrade = TRUE, credits_cost = ?, "
                    + "admission_order = ?, identity_key = ?, construction_started = NULL, construction_completed = NULL "
                    + "WHERE id = ? AND is_active = TRUE AND pending_upgrade = FALSE")) {
                ps.setLong(1, creditsCost);
                ps.setLong(2, order);
                ps.setString(3, identityKey);
                ps.setLong(4, recordId);
                statementsExecuted.incrementAndGet();
                updated = ps.executeUpdate();
            }
        } catch (SQLException e) {
            if (H2SchemaUtil.isIdentityRace(e)) {
                identityConflicts.incrementAndGet();
                throw new IdentityConflictException(identityKey, e);
            }
            throw failure("beginUpgrade", e);
        }
        if (updated == 0) {
            identityConflicts.incrementAndGet();
            throw new IdentityConflictException(identityKey, null);
        }
        return findRecord(recordId).orElseThrow(() -> new StoreException("Upgraded record " + recordId + " vanished", null));
    }

    private long nextAdmissionOrder(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("SELECT NEXT VALUE FOR admission_order_seq")) {
            statementsExecuted.incrementAndGet();
            rs.next();
            return rs.getLong(1);
        }
    }

    @Override
    public List<BaseRecord> findUnscheduled(String empireId, String coord, RecordKind kind) {
        return queryRecords("SELECT " + RECORD_COLUMNS + " FROM base_records "
            + "WHERE empire_id = ? AND location_coord = ? AND kind = ? AND is_active = FALSE "
            + "AND construction_started IS NULL ORDER BY admission_order", ps -> {
                ps.setString(1, empireId);
                ps.setString(2, coord);
                ps.setString(3, kind.name());
            });
    }

    @Override
    public Optional<BaseRecord> findInProgress(String empireId, String coord, RecordKind kind) {
        return first(queryRecords("SELECT " + RECORD_COLUMNS + " FROM base_records "
            + "WHERE empire_id = ? AND location_coord = ? AND kind = ? AND is_active = FALSE "
            + "AND construction_started IS NOT NULL ORDER BY construction_completed", ps -> {
                ps.setString(1, empireId);
                ps.setString(2, coord);
                ps.setString(3, kind.name());
            }));
    }

    @Override
    public boolean claimLane(long recordId, Instant started, Instant completes) {
        BaseRecord record = findRecord(recordId).orElse(null);
        if (record == null) {
            return false;
        }
        String laneSlot = record.empireId() + ":" + record.coord() + ":" + record.kind().name();
        try {
            return executeUpdate("claimLane",
                "UPDATE base_records SET construction_started = ?, construction_completed = ?, lane_slot = ? "
                    + "WHERE id = ? AND is_active = FALSE AND construction_started IS NULL",
                ps -> {
                    setInstant(ps, 1, started);
                    setInstant(ps, 2, completes);
                    ps.setString(3, laneSlot);
                    ps.setLong(4, recordId);
                }) == 1;
        } catch (IdentityConflictException e) {
            laneConflicts.incrementAndGet();
            log.debug("Lane {} already claimed, record {} stays queued", laneSlot, recordId);
            return false;
        }
    }

    @Override
    public List<LaneKey> findLanesWithUnscheduled() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "SELECT DISTINCT empire_id, location_coord, kind FROM base_records "
                     + "WHERE is_active = FALSE AND construction_started IS NULL ORDER BY empire_id, location_coord, kind")) {
            statementsExecuted.incrementAndGet();
            List<LaneKey> lanes = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    lanes.add(new LaneKey(rs.getString("empire_id"), rs.getString("location_coord"),
                        RecordKind.valueOf(rs.getString("kind"))));
                }
            }
            return lanes;
        } catch (SQLException e) {
            throw failure("findLanesWithUnscheduled", e);
        }
    }

    @Override
    public List<BaseRecord> findDueRecords(Instant now) {
        return queryRecords("SELECT " + RECORD_COLUMNS + " FROM base_records "
            + "WHERE is_active = FALSE AND construction_completed IS NOT NULL AND construction_completed <= ? "
            + "ORDER BY construction_completed, id", ps -> setInstant(ps, 1, now));
    }

    @Override
    public boolean completeRecord(BaseRecord due) {
        // a later upgrade of the same record gets a new admission order
        return executeUpdate("completeRecord",
            "UPDATE base_records SET is_active = TRUE, pending_upgrade = FALSE, level = GREATEST(level, ?), "
                + "credits_cost = 0, identity_key = NULL, lane_slot = NULL, "
                + "construction_started = NULL, construction_completed = NULL "
                + "WHERE id = ? AND is_active = FALSE AND admission_order = ? AND level = ?",
            ps -> {
                ps.setInt(1, due.targetLevel());
                ps.setLong(2, due.id());
                ps.setLong(3, due.admissionOrder());
                ps.setInt(4, due.level());
            }) == 1;
    }

    @Override
    public Optional<BaseRecord> cancelRecord(long recordId) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                BaseRecord record;
                try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT " + RECORD_COLUMNS + " FROM base_records WHERE id = ? FOR UPDATE")) {
                    ps.setLong(1, recordId);
                    try (ResultSet rs = ps.executeQuery()) {
                        record = rs.next() ? mapRecord(rs) : null;
                    }
                }
                if (record == null || !record.inFlight()) {
                    conn.rollback();
                    return Optional.empty();
                }

                String sql = record.pendingUpgrade()
                    ? "UPDATE base_records SET is_active = TRUE, pending_upgrade = FALSE, credits_cost = 0, "
                        + "identity_key = NULL, lane_slot = NULL, construction_started = NULL, construction_completed = NULL "
                        + "WHERE id = ? AND is_active = FALSE"
                    : "DELETE FROM base_records WHERE id = ? AND is_active = FALSE";
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setLong(1, recordId);
                    if (ps.executeUpdate() != 1) {
                        conn.rollback();
                        return Optional.empty();
                    }
                }

                if (record.started() && record.creditsCost() > 0) {
                    refund(conn, record.empireId(), record.creditsCost());
                }
                statementsExecuted.addAndGet(3);
                conn.commit();
                return Optional.of(record);
            } catch (SQLException e) {
                rollback(conn, "cancelRecord");
                throw e;
            }
        } catch (SQLException e) {
            throw failure("cancelRecord", e);
        }
    }

    private List<BaseRecord> queryRecords(String sql, StatementBinder binder) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            statementsExecuted.incrementAndGet();
            List<BaseRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRecord(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw failure("queryRecords", e);
        }
    }

    private BaseRecord mapRecord(ResultSet rs) throws SQLException {
        return new BaseRecord(
            rs.getLong("id"),
            RecordKind.valueOf(rs.getString("kind")),
            rs.getString("empire_id"),
            rs.getString("location_coord"),
            rs.getString("catalog_key"),
            rs.getInt("level"),
            rs.getBoolean("is_active"),
            rs.getBoolean("pending_upgrade"),
            rs.getLong("credits_cost"),
            rs.getLong("admission_order"),
            rs.getString("identity_key"),
            getInstant(rs, "construction_started"),
            getInstant(rs, "construction_completed"),
            getInstant(rs, "created_at"));
    }

    // Queue entries

    @Override
    public QueueEntry insertEntry(QueueType type, String empireId, String coord, String catalogKey, int level,
                                  int quantity, String identityKey, long creditsCost, Instant createdAt) {
        long id;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                 "INSERT INTO queue_entries (queue_type, empire_id, location_coord, catalog_key, level, quantity, "
                     + "identity_key, live_identity, status, charged, credits_cost, created_at) "
                     + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, FALSE, ?, ?)",
                 Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, type.name());
            ps.setString(2, empireId);
            ps.setString(3, coord);
            ps.setString(4, catalogKey);
            ps.setInt(5, level);
            ps.setInt(6, quantity);
            ps.setString(7, identityKey);
            ps.setString(8, identityKey);
            ps.setString(9, QueueStatus.PENDING.name());
            ps.setLong(10, creditsCost);
            setInstant(ps, 11, createdAt);
            statementsExecuted.incrementAndGet();
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                keys.next();
                id = keys.getLong(1);
            }
        } catch (SQLException e) {
            if (H2SchemaUtil.isIdentityRace(e)) {
                identityConflicts.incrementAndGet();
                throw new IdentityConflictException(identityKey, e);
            }
            throw failure("insertEntry", e);
        }
        return findEntry(id).orElseThrow(() -> new StoreException("Inserted entry " + id + " vanished", null));
    }

    @Override
    public Optional<QueueEntry> findEntry(long entryId) {
        return first(queryEntries("SELECT " + ENTRY_COLUMNS + " FROM queue_entries WHERE id = ?",
            ps -> ps.setLong(1, entryId)));
    }

    @Override
    public Optional<QueueEntry> findLiveEntry(String identityKey) {
        return first(queryEntries("SELECT " + ENTRY_COLUMNS + " FROM queue_entries WHERE live_identity = ?",
            ps -> ps.setString(1, identityKey)));
    }

    @Override
    public List<QueueEntry> findLiveEntries(String empireId, QueueType type) {
        return queryEntries("SELECT " + ENTRY_COLUMNS + " FROM queue_entries "
            + "WHERE empire_id = ? AND queue_type = ? AND live_identity IS NOT NULL ORDER BY created_at, id", ps -> {
                ps.setString(1, empireId);
                ps.setString(2, type.name());
            });
    }

    @Override
    public List<QueueEntry> findLiveEntries(String empireId, String coord) {
        return queryEntries("SELECT " + ENTRY_COLUMNS + " FROM queue_entries "
            + "WHERE empire_id = ? AND location_coord = ? AND live_identity IS NOT NULL ORDER BY created_at, id", ps -> {
                ps.setString(1, empireId);
                ps.setString(2, coord);
            });
    }

    @Override
    public boolean activateEntry(long entryId, Instant startedAt, Instant completesAt) {
        return executeUpdate("activateEntry",
            "UPDATE queue_entries SET status = 'ACTIVE', charged = TRUE, started_at = ?, completes_at = ? "
                + "WHERE id = ? AND status IN ('PENDING', 'QUEUED')",
            ps -> {
                setInstant(ps, 1, startedAt);
                setInstant(ps, 2, completesAt);
                ps.setLong(3, entryId);
            }) == 1;
    }

    @Override
    public boolean transitionEntry(long entryId, QueueStatus from, QueueStatus to) {
        String sql = to.isTerminal()
            ? "UPDATE queue_entries SET status = ?, live_identity = NULL WHERE id = ? AND status = ?"
            : "UPDATE queue_entries SET status = ? WHERE id = ? AND status = ?";
        return executeUpdate("transitionEntry", sql, ps -> {
            ps.setString(1, to.name());
            ps.setLong(2, entryId);
            ps.setString(3, from.name());
        }) == 1;
    }

    @Override
    public List<QueueEntry> findAwaitingActivation(QueueType type, Instant pendingBefore) {
        return queryEntries("SELECT " + ENTRY_COLUMNS + " FROM queue_entries WHERE queue_type = ? "
            + "AND (status = 'QUEUED' OR (status = 'PENDING' AND created_at <= ?)) ORDER BY created_at, id", ps -> {
                ps.setString(1, type.name());
                setInstant(ps, 2, pendingBefore);
            });
    }

    @Override
    public List<QueueEntry> findDueEntries(QueueType type, Instant now) {
        return queryEntries("SELECT " + ENTRY_COLUMNS + " FROM queue_entries WHERE queue_type = ? "
            + "AND status = 'ACTIVE' AND completes_at <= ? ORDER BY completes_at, id", ps -> {
                ps.setString(1, type.name());
                setInstant(ps, 2, now);
            });
    }

    @Override
    public boolean completeResearch(long entryId) {
        return completeEntry(entryId, QueueType.RESEARCH, (conn, entry) -> {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE empire_tech_levels SET level = GREATEST(level, ?) WHERE empire_id = ? AND tech_key = ?")) {
                ps.setInt(1, entry.level());
                ps.setString(2, entry.empireId());
                ps.setString(3, entry.catalogKey());
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO empire_tech_levels (empire_id, tech_key, level) VALUES (?, ?, ?)")) {
                    ps.setString(1, entry.empireId());
                    ps.setString(2, entry.catalogKey());
                    ps.setInt(3, entry.level());
                    ps.executeUpdate();
                }
            }
        });
    }

    @Override
    public boolean completeUnits(long entryId) {
        return completeEntry(entryId, QueueType.UNITS, (conn, entry) -> {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(
                "UPDATE empire_units SET unit_count = unit_count + ? "
                    + "WHERE empire_id = ? AND location_coord = ? AND unit_key = ?")) {
                ps.setLong(1, entry.quantity());
                ps.setString(2, entry.empireId());
                ps.setString(3, entry.coord());
                ps.setString(4, entry.catalogKey());
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO empire_units (empire_id, location_coord, unit_key, unit_count) VALUES (?, ?, ?, ?)")) {
                    ps.setString(1, entry.empireId());
                    ps.setString(2, entry.coord());
                    ps.setString(3, entry.catalogKey());
                    ps.setLong(4, entry.quantity());
                    ps.executeUpdate();
                }
            }
        });
    }

    /**
     * Claims an active entry as completed and applies its effect in the same transaction, so
     * the effect is applied exactly once however many ticks observe the entry.
     */
    private boolean completeEntry(long entryId, QueueType type, CompletionEffect effect) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                QueueEntry entry;
                try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT " + ENTRY_COLUMNS + " FROM queue_entries WHERE id = ? FOR UPDATE")) {
                    ps.setLong(1, entryId);
                    try (ResultSet rs = ps.executeQuery()) {
                        entry = rs.next() ? mapEntry(rs) : null;
                    }
                }
                if (entry == null || entry.type() != type || entry.status() != QueueStatus.ACTIVE) {
                    conn.rollback();
                    return false;
                }
                try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE queue_entries SET status = 'COMPLETED', live_identity = NULL WHERE id = ? AND status = 'ACTIVE'")) {
                    ps.setLong(1, entryId);
                    if (ps.executeUpdate() != 1) {
                        conn.rollback();
                        return false;
                    }
                }
                effect.apply(conn, entry);
                statementsExecuted.addAndGet(3);
                conn.commit();
                return true;
            } catch (SQLException e) {
                rollback(conn, "completeEntry");
                throw e;
            }
        } catch (SQLException e) {
            throw failure("completeEntry", e);
        }
    }

    @Override
    public Optional<QueueEntry> cancelEntry(long entryId) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                QueueEntry entry;
                try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT " + ENTRY_COLUMNS + " FROM queue_entries WHERE id = ? FOR UPDATE")) {
                    ps.setLong(1, entryId);
                    try (ResultSet rs = ps.executeQuery()) {
                        entry = rs.next() ? mapEntry(rs) : null;
                    }
                }
                if (entry == null || entry.status().isTerminal()) {
                    conn.rollback();
                    return Optional.empty();
                }
                try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE queue_entries SET status = 'CANCELLED', live_identity = NULL WHERE id = ? AND status = ?")) {
                    ps.setLong(1, entryId);
                    ps.setString(2, entry.status().name());
                    if (ps.executeUpdate() != 1) {
                        conn.rollback();
                        return Optional.empty();
                    }
                }
                if (entry.charged() && entry.creditsCost() > 0) {
                    refund(conn, entry.empireId(), entry.creditsCost());
                }
                statementsExecuted.addAndGet(3);
                conn.commit();
                return Optional.of(entry);
            } catch (SQLException e) {
                rollback(conn, "cancelEntry");
                throw e;
            }
        } catch (SQLException e) {
            throw failure("cancelEntry", e);
        }
    }

    private List<QueueEntry> queryEntries(String sql, StatementBinder binder) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            statementsExecuted.incrementAndGet();
            List<QueueEntry> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(mapEntry(rs));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw failure("queryEntries", e);
        }
    }

    private QueueEntry mapEntry(ResultSet rs) throws SQLException {
        return new QueueEntry(
            rs.getLong("id"),
            QueueType.valueOf(rs.getString("queue_type")),
            rs.getString("empire_id"),
            rs.getString("location_coord"),
            rs.getString("catalog_key"),
            rs.getInt("level"),
            rs.getInt("quantity"),
            rs.getString("identity_key"),
            QueueStatus.valueOf(rs.getString("status")),
            rs.getBoolean("charged"),
            rs.getLong("credits_cost"),
            getInstant(rs, "created_at"),
            getInstant(rs, "started_at"),
            getInstant(rs, "completes_at"));
    }

    // Helpers

    private void refund(Connection conn, String empireId, long amount) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE empires SET credits = credits + ? WHERE id = ?")) {
            ps.setLong(1, amount);
            ps.setString(2, empireId);
            ps.executeUpdate();
        }
    }

    private int executeUpdate(String operation, String sql, StatementBinder binder) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            statementsExecuted.incrementAndGet();
            return ps.executeUpdate();
        } catch (SQLException e) {
            if (H2SchemaUtil.isUniqueViolation(e)) {
                throw new IdentityConflictException(operation, e);
            }
            throw failure(operation, e);
        }
    }

    private void rollback(Connection conn, String operation) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed during {} (connection may be closed): {}", operation, rollbackEx.getMessage());
        }
    }

    private StoreException failure(String operation, SQLException e) {
        log.warn("H2 store '{}' failed during {}: {}", resourceName, operation, e.getMessage());
        recordError("QUERY_FAILED", "Store operation failed: " + operation, e.getMessage());
        return new StoreException("Store operation failed: " + operation, e);
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("statements_executed", statementsExecuted.get());
        metrics.put("identity_conflicts", identityConflicts.get());
        metrics.put("lane_conflicts", laneConflicts.get());
        if (dataSource.getHikariPoolMXBean() != null) {
            metrics.put("connections_active", dataSource.getHikariPoolMXBean().getActiveConnections());
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.debug("H2 store '{}' closed", resourceName);
        }
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    private interface CompletionEffect {
        void apply(Connection conn, QueueEntry entry) throws SQLException;
    }
}
