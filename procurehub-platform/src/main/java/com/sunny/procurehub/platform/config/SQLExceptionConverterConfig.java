package com.sunny.procurehub.platform.config;

import com.sunny.procurehub.common.exception.db.SQLExceptionConverter;
import com.sunny.procurehub.common.exception.db.SQLExceptionConverterFactory;
import com.sunny.procurehub.common.exception.db.SQLExceptionUtils;
import javax.sql.DataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * SQL 异常转换器配置
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Configuration
public class SQLExceptionConverterConfig {

    @Bean
    public SQLExceptionConverter sqlExceptionConverter(DataSource dataSource) {
        SQLExceptionConverter converter = SQLExceptionConverterFactory.create(dataSource);
        SQLExceptionUtils.initialize(converter);
        return converter;
    }
}
