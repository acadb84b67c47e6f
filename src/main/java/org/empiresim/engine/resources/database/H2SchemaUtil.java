package org.empiresim.engine.resources.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;

/**
 * H2-specific DDL helpers.
 */
public final class H2SchemaUtil {

    private static final Logger log = LoggerFactory.getLogger(H2SchemaUtil.class);

    /** SQLState class of integrity constraint violations (duplicate key, unique index). */
    private static final String INTEGRITY_VIOLATION_CLASS = "23";

    private H2SchemaUtil() {
        // Utility class - prevent instantiation
    }

    /**
     * Executes a {@code CREATE ... IF NOT EXISTS} statement.
     * <p>
     * H2 2.2.224 can report "object already exists" when several connections create the same object
     * concurrently. That error is treated as success.
     *
     * @param statement  The statement to execute with.
     * @param sql        The DDL.
     * @param objectName Table or index name for logging.
     * @throws SQLException if the DDL fails for any other reason.
     */
    public static void executeDdlIfNotExists(Statement statement, String sql, String objectName) throws SQLException {
        if (statement == null || sql == null || objectName == null) {
            throw new IllegalArgumentException("statement, sql, and objectName must not be null");
        }
        try {
            statement.execute(sql);
            log.debug("Ensured database object: {}", objectName);
        } catch (SQLException e) {
            // 42101 = table/view already exists, 50000 = general error that may carry the same message
            if ((e.getErrorCode() == 42101 || e.getErrorCode() == 50000)
                && e.getMessage() != null
                && e.getMessage().contains("already exists")) {
                log.debug("Database object '{}' already exists (created by another connection)", objectName);
            } else {
                throw e;
            }
        }
    }

    /**
     * @return {@code true} if the exception is a unique or primary key violation.
     */
    public static boolean isIntegrityViolation(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith(INTEGRITY_VIOLATION_CLASS);
    }
}
