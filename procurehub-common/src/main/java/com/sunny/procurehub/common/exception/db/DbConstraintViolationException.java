package com.sunny.procurehub.common.exception.db;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;

/**
 * 约束冲突异常
 * 逻辑错误，不可重试；由业务层按场景翻译为领域异常
 *
 * @author Sunny
 * @date 2026-02-26
 */
public class DbConstraintViolationException extends DbStorageException {

    private final Kind kind;

    public DbConstraintViolationException(Kind kind,
                                          Throwable cause,
                                          Integer errorCode,
                                          String sqlState,
                                          String constraintName) {
        super(
                kind == Kind.UNIQUE ? Code.CONFLICT : Code.BAD_REQUEST,
                ErrorType.STORE_CONSTRAINT_VIOLATION,
                false,
                errorCode,
                sqlState,
                constraintName,
                cause,
                "数据库约束冲突"
        );
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isUnique() {
        return kind == Kind.UNIQUE;
    }

    public enum Kind {
        UNIQUE,
        FOREIGN_KEY,
        NOT_NULL,
        CHECK,
        DATA_TOO_LONG
    }
}
