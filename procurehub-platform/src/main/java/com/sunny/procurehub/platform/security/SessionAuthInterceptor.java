package com.sunny.procurehub.platform.security;

import com.sunny.procurehub.platform.exception.auth.UnauthenticatedException;
import com.sunny.procurehub.platform.module.user.service.SessionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 会话认证拦截器
 * 每个请求解析一次 (user, company, team, role, permissions) 并挂到请求属性上
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Component
@RequiredArgsConstructor
public class SessionAuthInterceptor implements HandlerInterceptor {

    private static final List<String> ANONYMOUS_PATHS = List.of(
            "/auth/**",
            "/invites/validate/**",
            "/v3/api-docs/**",
            "/swagger-ui/**",
            "/swagger-ui.html",
            "/error"
    );

    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final SessionService sessionService;
    private final PlatformCookieManager cookieManager;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        Optional<AuthContext> context = sessionService.resolve(cookieManager.readSessionToken(request));
        context.ifPresent(value -> AuthContext.attach(request, value));
        if (context.isPresent() || isAnonymousAllowed(request.getRequestURI())) {
            return true;
        }
        throw new UnauthenticatedException();
    }

    private boolean isAnonymousAllowed(String path) {
        return ANONYMOUS_PATHS.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }
}
