package com.cohortaccel.service.execution;

import com.cohortaccel.model.enums.ExecutionErrorKind;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.Locale;

/**
 * Maps data-access failures onto the execution error taxonomy.
 * <p>
 * Order: timeout types, then SQLState (42S* schema, other 42* syntax,
 * 57014/HYT* timeout), then message text, then the Spring exception type.
 */
@Component
public class ExecutionErrorClassifier {

    public ExecutionErrorKind classify(DataAccessException e) {
        if (e instanceof QueryTimeoutException) {
            return ExecutionErrorKind.TIMEOUT;
        }
        SQLException sqlException = findSqlException(e);
        if (sqlException instanceof SQLTimeoutException) {
            return ExecutionErrorKind.TIMEOUT;
        }
        String state = sqlException != null ? sqlException.getSQLState() : null;
        if (state != null) {
            if (state.equals("57014") || state.startsWith("HYT")) {
                return ExecutionErrorKind.TIMEOUT;
            }
            if (state.startsWith("42S")) {
                return ExecutionErrorKind.SCHEMA_ERROR;
            }
            if (state.startsWith("42")) {
                return ExecutionErrorKind.SYNTAX_ERROR;
            }
        }

        String message = (sqlException != null ? sqlException.getMessage() : e.getMessage());
        String text = message != null ? message.toLowerCase(Locale.ROOT) : "";
        if (text.contains("syntax error")) {
            return ExecutionErrorKind.SYNTAX_ERROR;
        }
        if (text.contains("no such table") || text.contains("no such column")
                || text.contains("not found") || text.contains("unknown column")) {
            return ExecutionErrorKind.SCHEMA_ERROR;
        }
        if (text.contains("timeout") || text.contains("timed out") || text.contains("canceled")) {
            return ExecutionErrorKind.TIMEOUT;
        }
        if (e instanceof BadSqlGrammarException) {
            return ExecutionErrorKind.SYNTAX_ERROR;
        }
        return ExecutionErrorKind.DATABASE_ERROR;
    }

    private SQLException findSqlException(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException sql) {
                return sql;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }
}
