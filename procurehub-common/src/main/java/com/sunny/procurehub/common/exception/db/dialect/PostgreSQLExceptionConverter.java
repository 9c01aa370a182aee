package com.sunny.procurehub.common.exception.db.dialect;

import com.sunny.procurehub.common.exception.db.ConstraintNameExtractor;
import com.sunny.procurehub.common.exception.db.DbConstraintViolationException;
import com.sunny.procurehub.common.exception.db.DbConstraintViolationException.Kind;
import com.sunny.procurehub.common.exception.db.DbInternalException;
import com.sunny.procurehub.common.exception.db.DbStorageException;
import com.sunny.procurehub.common.exception.db.DbUnavailableException;
import com.sunny.procurehub.common.exception.db.DbUnavailableException.Reason;
import com.sunny.procurehub.common.exception.db.SQLExceptionConverter;
import com.sunny.procurehub.common.exception.db.SqlDialect;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;

/**
 * PostgreSQL SQL 异常转换器
 *
 * @author Sunny
 * @date 2026-02-26
 */
public class PostgreSQLExceptionConverter implements SQLExceptionConverter {

    @Override
    public SqlDialect dialect() {
        return SqlDialect.POSTGRESQL;
    }

    @Override
    public DbStorageException convert(SQLException sqlException) {
        int errorCode = sqlException.getErrorCode();
        String sqlState = sqlException.getSQLState();
        String constraintName = ConstraintNameExtractor.extract(sqlException).orElse(null);

        if (sqlException instanceof SQLTimeoutException) {
            return new DbUnavailableException(Reason.QUERY_TIMEOUT, sqlException, errorCode, sqlState, constraintName);
        }
        if (sqlState == null) {
            return new DbInternalException(sqlException, errorCode, null);
        }

        switch (sqlState) {
            case "23505":
                return constraint(Kind.UNIQUE, sqlException, errorCode, sqlState, constraintName);
            case "23503":
                return constraint(Kind.FOREIGN_KEY, sqlException, errorCode, sqlState, constraintName);
            case "23502":
                return constraint(Kind.NOT_NULL, sqlException, errorCode, sqlState, constraintName);
            case "23514":
                return constraint(Kind.CHECK, sqlException, errorCode, sqlState, constraintName);
            case "22001":
                return constraint(Kind.DATA_TOO_LONG, sqlException, errorCode, sqlState, constraintName);
            case "40P01":
            case "40001":
                return new DbUnavailableException(Reason.DEADLOCK, sqlException, errorCode, sqlState, constraintName);
            case "55P03":
                return new DbUnavailableException(Reason.LOCK_TIMEOUT, sqlException, errorCode, sqlState, constraintName);
            case "57014":
                return new DbUnavailableException(Reason.QUERY_TIMEOUT, sqlException, errorCode, sqlState, constraintName);
            default:
                break;
        }

        if (sqlState.startsWith("08") || "53300".equals(sqlState)) {
            return new DbUnavailableException(Reason.CONNECTION_FAILED, sqlException, errorCode, sqlState, constraintName);
        }

        return new DbInternalException(sqlException, errorCode, sqlState);
    }

    private DbConstraintViolationException constraint(Kind kind,
                                                      SQLException sqlException,
                                                      int errorCode,
                                                      String sqlState,
                                                      String constraintName) {
        return new DbConstraintViolationException(kind, sqlException, errorCode, sqlState, constraintName);
    }
}
