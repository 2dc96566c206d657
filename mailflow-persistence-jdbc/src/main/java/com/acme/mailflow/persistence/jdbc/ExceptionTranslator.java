package com.acme.mailflow.persistence.jdbc;

import com.acme.mailflow.core.PermanentException;
import com.acme.mailflow.core.TransientException;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Translates SQLException into the retry vocabulary of the job runtime: transient failures are
 * retried with backoff, permanent ones end the job.
 */
public final class ExceptionTranslator {

    // PostgreSQL and H2 vendor codes
    private static final Set<Integer> TRANSIENT_CODES = Set.of(40001, 8003, 8006, 90008);
    private static final Set<Integer> PERMANENT_CODES = Set.of(42703, 23505, 23503, 90002, 90007, 42122);

    private ExceptionTranslator() {
    }

    /**
     * @param operation what was being attempted, used in the log line and the exception message
     * @return an exception to throw; never null
     */
    public static RuntimeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, originalException);

        if (isTransientError(originalException)) {
            return new TransientException(
                    String.format("Transient database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }
        if (isPermanentError(originalException)) {
            return new PermanentException(
                    String.format("Permanent database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }
        // Unknown errors are retried
        return new TransientException(
                String.format("Database error during %s: %s", operation, originalException.getMessage()),
                originalException);
    }

    static boolean isTransientError(SQLException exception) {
        String message = lowerMessage(exception);
        if (message.contains("timeout") || message.contains("connection refused")
                || message.contains("deadlock") || message.contains("too many connections")
                || message.contains("pool exhausted")) {
            return true;
        }
        String sqlState = exception.getSQLState();
        if (sqlState != null
                && (sqlState.startsWith("08") || sqlState.startsWith("40") || sqlState.equals("57P03"))) {
            return true;
        }
        return TRANSIENT_CODES.contains(exception.getErrorCode());
    }

    static boolean isPermanentError(SQLException exception) {
        String message = lowerMessage(exception);
        if (message.contains("syntax error") || message.contains("not found")
                || message.contains("does not exist") || message.contains("constraint")
                || message.contains("foreign key") || message.contains("type mismatch")) {
            return true;
        }
        String sqlState = exception.getSQLState();
        if (sqlState != null
                && (sqlState.startsWith("22") || sqlState.startsWith("23") || sqlState.startsWith("42")
                        || sqlState.startsWith("3D") || sqlState.startsWith("3F"))) {
            return true;
        }
        return PERMANENT_CODES.contains(exception.getErrorCode());
    }

    private static String lowerMessage(SQLException exception) {
        return exception.getMessage() == null ? "" : exception.getMessage().toLowerCase(Locale.ROOT);
    }
}
