package com.sunny.procurehub.common.exception.db;

import com.sunny.procurehub.common.exception.ProcurehubRuntimeException;
import java.util.Locale;
import java.util.Map;

/**
 * 存储层异常基类
 * 记录驱动错误码、SQLSTATE 与约束名
 *
 * @author Sunny
 * @date 2026-02-26
 */
public abstract class DbStorageException extends ProcurehubRuntimeException {

    private final Integer errorCode;
    private final String sqlState;
    private final String constraintName;

    protected DbStorageException(int code,
                                 String type,
                                 boolean retryable,
                                 Integer errorCode,
                                 String sqlState,
                                 String constraintName,
                                 Throwable cause,
                                 String message) {
        super(cause, code, type, (Map<String, String>) null, retryable, message);
        this.errorCode = errorCode;
        this.sqlState = sqlState == null || sqlState.isBlank() ? null : sqlState.trim().toUpperCase(Locale.ROOT);
        this.constraintName = normalizeConstraintName(constraintName);
    }

    public Integer getErrorCode() {
        return errorCode;
    }

    public String getSqlState() {
        return sqlState;
    }

    public String getConstraintName() {
        return constraintName;
    }

    private static String normalizeConstraintName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
