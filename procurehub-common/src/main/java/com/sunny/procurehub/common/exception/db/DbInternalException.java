package com.sunny.procurehub.common.exception.db;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;

/**
 * 无法归类的存储异常
 * 不可重试，对外统一为服务器内部错误，SQLSTATE 只进日志
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class DbInternalException extends DbStorageException {

    public DbInternalException(Throwable cause, Integer errorCode, String sqlState) {
        super(Code.INTERNAL_ERROR, ErrorType.STORE_INTERNAL, false, errorCode, sqlState, null, cause,
                sqlState == null ? "未归类的数据库错误" : "未归类的数据库错误, SQLSTATE " + sqlState);
    }
}
