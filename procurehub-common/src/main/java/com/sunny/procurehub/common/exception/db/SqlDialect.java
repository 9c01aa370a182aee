package com.sunny.procurehub.common.exception.db;

import java.util.Locale;

/**
 * 支持的数据库方言
 * 生产只跑 PostgreSQL，H2 以 PostgreSQL 兼容模式用于测试
 *
 * @author Sunny
 * @date 2026-03-02
 */
public enum SqlDialect {

    POSTGRESQL(":postgresql:", "postgresql"),
    H2(":h2:", "h2");

    private final String urlMarker;
    private final String driverMarker;

    SqlDialect(String urlMarker, String driverMarker) {
        this.urlMarker = urlMarker;
        this.driverMarker = driverMarker;
    }

    /**
     * 无法识别时按 PostgreSQL 处理
     */
    public static SqlDialect detect(String jdbcUrl, String driverName) {
        String url = jdbcUrl == null ? "" : jdbcUrl.toLowerCase(Locale.ROOT);
        String driver = driverName == null ? "" : driverName.toLowerCase(Locale.ROOT);
        // H2 的 PostgreSQL 模式 URL 中也含 postgresql，先判 H2
        if (url.contains(H2.urlMarker) || driver.contains(H2.driverMarker)) {
            return H2;
        }
        return POSTGRESQL;
    }
}
