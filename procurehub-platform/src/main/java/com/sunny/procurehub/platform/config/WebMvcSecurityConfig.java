package com.sunny.procurehub.platform.config;

import com.sunny.procurehub.platform.security.CsrfInterceptor;
import com.sunny.procurehub.platform.security.SessionAuthInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * WebMvc安全配置
 * 会话解析先于 CSRF 校验
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Configuration
public class WebMvcSecurityConfig implements WebMvcConfigurer {

    private final SessionAuthInterceptor sessionAuthInterceptor;
    private final CsrfInterceptor csrfInterceptor;

    public WebMvcSecurityConfig(SessionAuthInterceptor sessionAuthInterceptor, CsrfInterceptor csrfInterceptor) {
        this.sessionAuthInterceptor = sessionAuthInterceptor;
        this.csrfInterceptor = csrfInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(sessionAuthInterceptor)
                .addPathPatterns("/**")
                .order(0);
        registry.addInterceptor(csrfInterceptor)
                .addPathPatterns("/**")
                .order(1);
    }
}
