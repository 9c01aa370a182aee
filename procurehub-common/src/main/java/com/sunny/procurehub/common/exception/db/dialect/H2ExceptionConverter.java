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

/**
 * H2 SQL 异常转换器
 * 测试环境使用，按 H2 错误码判定
 *
 * @author Sunny
 * @date 2026-02-26
 */
public class H2ExceptionConverter implements SQLExceptionConverter {

    private static final int ERROR_DUPLICATE_KEY = 23505;
    private static final int ERROR_FOREIGN_KEY_PARENT_MISSING = 23506;
    private static final int ERROR_FOREIGN_KEY_CHILD_EXISTS = 23503;
    private static final int ERROR_NOT_NULL = 23502;
    private static final int ERROR_CHECK = 23513;
    private static final int ERROR_TOO_LONG = 22001;
    private static final int ERROR_DEADLOCK = 40001;
    private static final int ERROR_LOCK_TIMEOUT = 50200;
    private static final int ERROR_STATEMENT_CANCELED = 57014;

    @Override
    public SqlDialect dialect() {
        return SqlDialect.H2;
    }

    @Override
    public DbStorageException convert(SQLException sqlException) {
        int errorCode = sqlException.getErrorCode();
        String sqlState = sqlException.getSQLState();
        String constraintName = ConstraintNameExtractor.extract(sqlException).orElse(null);

        switch (errorCode) {
            case ERROR_DUPLICATE_KEY:
                return constraint(Kind.UNIQUE, sqlException, errorCode, sqlState, constraintName);
            case ERROR_FOREIGN_KEY_PARENT_MISSING:
            case ERROR_FOREIGN_KEY_CHILD_EXISTS:
                return constraint(Kind.FOREIGN_KEY, sqlException, errorCode, sqlState, constraintName);
            case ERROR_NOT_NULL:
                return constraint(Kind.NOT_NULL, sqlException, errorCode, sqlState, constraintName);
            case ERROR_CHECK:
                return constraint(Kind.CHECK, sqlException, errorCode, sqlState, constraintName);
            case ERROR_TOO_LONG:
                return constraint(Kind.DATA_TOO_LONG, sqlException, errorCode, sqlState, constraintName);
            case ERROR_DEADLOCK:
                return new DbUnavailableException(Reason.DEADLOCK, sqlException, errorCode, sqlState, constraintName);
            case ERROR_LOCK_TIMEOUT:
                return new DbUnavailableException(Reason.LOCK_TIMEOUT, sqlException, errorCode, sqlState, constraintName);
            case ERROR_STATEMENT_CANCELED:
                return new DbUnavailableException(Reason.QUERY_TIMEOUT, sqlException, errorCode, sqlState, constraintName);
            default:
                break;
        }

        if (sqlState != null && sqlState.startsWith("08")) {
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
