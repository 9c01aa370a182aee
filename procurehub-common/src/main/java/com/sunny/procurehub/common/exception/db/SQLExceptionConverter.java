package com.sunny.procurehub.common.exception.db;

import java.sql.SQLException;

/**
 * SQL 异常转换器
 * 把驱动异常归入约束冲突、暂不可用、内部错误三类
 *
 * @author Sunny
 * @date 2026-03-02
 */
public interface SQLExceptionConverter {

    SqlDialect dialect();

    DbStorageException convert(SQLException sqlException);
}
