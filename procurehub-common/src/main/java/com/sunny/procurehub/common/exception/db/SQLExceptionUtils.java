package com.sunny.procurehub.common.exception.db;

import com.sunny.procurehub.common.exception.ProcurehubRuntimeException;
import java.sql.SQLException;
import java.util.Optional;

/**
 * SQL 异常工具
 * 事务执行器据此决定重试、保存点回放或交给场景翻译
 *
 * @author Sunny
 * @date 2026-03-02
 */
public final class SQLExceptionUtils {

    private static volatile SQLExceptionConverter converter = SQLExceptionConverterFactory.create(SqlDialect.POSTGRESQL);

    private SQLExceptionUtils() {
    }

    public static void initialize(SQLExceptionConverter configuredConverter) {
        converter = configuredConverter == null
                ? SQLExceptionConverterFactory.create(SqlDialect.POSTGRESQL)
                : configuredConverter;
    }

    public static SqlDialect currentDialect() {
        return converter.dialect();
    }

    /**
     * 已翻译的存储异常直接返回；领域异常不是存储故障，返回 null；否则转换异常链中的 SQLException
     */
    public static DbStorageException resolve(Throwable throwable) {
        if (throwable instanceof DbStorageException dbException) {
            return dbException;
        }
        if (throwable instanceof ProcurehubRuntimeException) {
            return null;
        }
        return translate(throwable);
    }

    /**
     * 返回 null 表示异常链中没有 SQLException
     */
    public static DbStorageException translate(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof SQLException sqlException) {
                return converter.convert(sqlException);
            }
            cursor = cursor.getCause();
        }
        return null;
    }

    /**
     * 唯一约束冲突时返回约束名，约束名无法解析时返回空串
     */
    public static Optional<String> uniqueViolation(Throwable throwable) {
        if (resolve(throwable) instanceof DbConstraintViolationException violation && violation.isUnique()) {
            return Optional.of(violation.getConstraintName() == null ? "" : violation.getConstraintName());
        }
        return Optional.empty();
    }
}
