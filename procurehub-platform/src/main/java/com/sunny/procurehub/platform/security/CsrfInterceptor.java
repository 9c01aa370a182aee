package com.sunny.procurehub.platform.security;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import com.sunny.procurehub.platform.exception.auth.CsrfInvalidException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 双提交 CSRF 拦截器
 * 携带会话 Cookie 的写请求必须带上与 CSRF Cookie 一致的请求头
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsrfInterceptor implements HandlerInterceptor {

    private static final List<String> CSRF_WHITELIST = List.of(
            "/auth/login",
            "/auth/register",
            "/auth/logout",
            "/auth/verify-email"
    );

    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final PlatformSecurityProperties securityProperties;
    private final PlatformCookieManager cookieManager;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (isSafeMethod(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI();
        if (isWhitelisted(path)) {
            return true;
        }
        // 无会话的写请求交给会话拦截器拒绝
        if (cookieManager.readSessionToken(request) == null) {
            return true;
        }

        String headerToken = request.getHeader(securityProperties.getCsrf().getHeaderName());
        String cookieToken = cookieManager.readCsrfToken(request);
        if (!TokenGenerator.constantTimeEquals(headerToken, cookieToken)) {
            log.warn("security_event event=csrf_rejected method={} path={} headerPresent={}",
                    request.getMethod(), path, headerToken != null);
            throw new CsrfInvalidException();
        }
        return true;
    }

    private boolean isSafeMethod(String method) {
        return "GET".equalsIgnoreCase(method)
                || "HEAD".equalsIgnoreCase(method)
                || "OPTIONS".equalsIgnoreCase(method);
    }

    private boolean isWhitelisted(String path) {
        return CSRF_WHITELIST.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }
}
