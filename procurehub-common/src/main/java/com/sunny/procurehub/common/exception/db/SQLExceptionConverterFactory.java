package com.sunny.procurehub.common.exception.db;

import com.sunny.procurehub.common.exception.db.dialect.H2ExceptionConverter;
import com.sunny.procurehub.common.exception.db.dialect.PostgreSQLExceptionConverter;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.Map;
import javax.sql.DataSource;

/**
 * SQL 异常转换器工厂
 * 启动时读取一次数据源元数据确定方言
 *
 * @author Sunny
 * @date 2026-03-02
 */
public final class SQLExceptionConverterFactory {

    private static final Map<SqlDialect, SQLExceptionConverter> CONVERTERS = new EnumMap<>(SqlDialect.class);

    static {
        CONVERTERS.put(SqlDialect.POSTGRESQL, new PostgreSQLExceptionConverter());
        CONVERTERS.put(SqlDialect.H2, new H2ExceptionConverter());
    }

    private SQLExceptionConverterFactory() {
    }

    public static SQLExceptionConverter create(SqlDialect dialect) {
        return CONVERTERS.get(dialect == null ? SqlDialect.POSTGRESQL : dialect);
    }

    public static SQLExceptionConverter create(DataSource dataSource) {
        if (dataSource == null) {
            return create(SqlDialect.POSTGRESQL);
        }
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metadata = connection.getMetaData();
            if (metadata == null) {
                return create(SqlDialect.POSTGRESQL);
            }
            return create(SqlDialect.detect(metadata.getURL(), metadata.getDriverName()));
        } catch (SQLException ex) {
            // 启动期连不上库时仍按生产方言处理，真正的连接错误留给首个事务暴露
            return create(SqlDialect.POSTGRESQL);
        }
    }
}
