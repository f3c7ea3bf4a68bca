package de.bsommerfeld.marketscope.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Maps driver exceptions onto the {@link StoreException} hierarchy. This is
 * the single place where storage failures get logged.
 */
final class SqlErrors {

    private static final Logger LOG = LoggerFactory.getLogger(SqlErrors.class);

    private SqlErrors() {
    }

    static StoreException translate(String operation, SQLException e) {
        if (isForeignKeyViolation(e)) {
            LOG.warn("[DB] {} referenced a missing parent row: {}", operation, e.getMessage());
            return new NotFoundException(operation + ": referenced row does not exist", e);
        }
        if (isConstraintViolation(e)) {
            LOG.warn("[DB] {} violated a constraint: {}", operation, e.getMessage());
            return new ConstraintViolationException(operation + ": " + e.getMessage(), e);
        }
        LOG.error("[DB] {} failed", operation, e);
        return new StorageUnavailableException(operation + " failed", e);
    }

    private static boolean isForeignKeyViolation(SQLException e) {
        if (e instanceof SQLiteException sqlite
                && sqlite.getResultCode() == SQLiteErrorCode.SQLITE_CONSTRAINT_FOREIGNKEY) {
            return true;
        }
        return isConstraintViolation(e) && message(e).contains("foreign key");
    }

    private static boolean isConstraintViolation(SQLException e) {
        if (e instanceof SQLiteException sqlite && sqlite.getResultCode() != null) {
            return sqlite.getResultCode().name().startsWith("SQLITE_CONSTRAINT");
        }
        return message(e).contains("constraint");
    }

    private static String message(SQLException e) {
        return e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
    }
}
