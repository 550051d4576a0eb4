package org.attrition.engine.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;

/**
 * Helpers for creating the H2 schema and classifying H2 errors.
 */
public final class H2SchemaUtil {

    private static final Logger log = LoggerFactory.getLogger(H2SchemaUtil.class);

    /**
     * SQLState of a unique index or primary key violation.
     */
    public static final String UNIQUE_VIOLATION_STATE = "23505";

    private H2SchemaUtil() {
        // Utility class - prevent instantiation
    }

    /**
     * Executes a CREATE TABLE / INDEX / SEQUENCE statement, tolerating the object already
     * existing.
     * <p>
     * H2 bug workaround: "CREATE TABLE IF NOT EXISTS" can fail with "object already exists"
     * when several connections create the same object concurrently.
     *
     * @param statement statement to execute on
     * @param sql       DDL statement
     * @param name      object name, for logging
     * @throws SQLException for any other error
     */
    public static void executeTableCreation(Statement statement, String sql, String name) throws SQLException {
        if (statement == null || sql == null || name == null) {
            throw new IllegalArgumentException("statement, sql, and name must not be null");
        }

        try {
            statement.execute(sql);
            log.debug("Created schema object: {}", name);
        } catch (SQLException e) {
            // 42101 = table/view already exists, 50000 = general error
            if ((e.getErrorCode() == 42101 || e.getErrorCode() == 50000)
                && e.getMessage() != null
                && e.getMessage().contains("already exists")) {
                log.debug("Schema object '{}' already exists (created by another connection)", name);
            } else {
                throw e;
            }
        }
    }

    /**
     * H2 error code raised when a row is changed by a concurrent, not yet committed transaction.
     */
    public static final int CONCURRENT_UPDATE_CODE = 90131;

    public static boolean isUniqueViolation(SQLException e) {
        return UNIQUE_VIOLATION_STATE.equals(e.getSQLState());
    }

    /**
     * Whether an insert lost against another writer of the same unique key, either after it
     * committed or while it was still in flight.
     */
    public static boolean isIdentityRace(SQLException e) {
        return isUniqueViolation(e) || e.getErrorCode() == CONCURRENT_UPDATE_CODE;
    }
}
