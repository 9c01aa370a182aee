package com.sunny.procurehub.common.exception.db;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;

/**
 * 存储暂不可用异常
 * 死锁、锁等待超时、语句超时与连接失败，均可重试
 *
 * @author Sunny
 * @date 2026-02-26
 */
public class DbUnavailableException extends DbStorageException {

    private final Reason reason;

    public DbUnavailableException(Reason reason,
                                  Throwable cause,
                                  Integer errorCode,
                                  String sqlState,
                                  String constraintName) {
        super(
                Code.SERVICE_UNAVAILABLE,
                reason == Reason.QUERY_TIMEOUT ? ErrorType.STORE_TIMEOUT : ErrorType.STORE_UNAVAILABLE,
                true,
                errorCode,
                sqlState,
                constraintName,
                cause,
                reason == Reason.QUERY_TIMEOUT ? "数据库操作超时" : "数据库暂不可用"
        );
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        DEADLOCK,
        LOCK_TIMEOUT,
        QUERY_TIMEOUT,
        CONNECTION_FAILED
    }
}
