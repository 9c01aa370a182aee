package com.sunny.procurehub.platform.security;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * 平台CookieManager组件
 * 会话与访客 Cookie 为 HttpOnly，CSRF Cookie 需前端可读
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Component
@RequiredArgsConstructor
public class PlatformCookieManager {

    private final PlatformSecurityProperties securityProperties;

    public void setSessionCookies(HttpServletResponse response, String sessionToken, String csrfToken) {
        Duration sessionTtl = securityProperties.getSession().getTtl();
        PlatformSecurityProperties.Cookie cookie = securityProperties.getCookie();
        addCookieHeader(response, buildCookie(cookie.getSessionName(), sessionToken, true, sessionTtl));
        addCookieHeader(response, buildCookie(cookie.getCsrfName(), csrfToken, false, sessionTtl));
    }

    public void setCsrfCookie(HttpServletResponse response, String csrfToken) {
        addCookieHeader(response, buildCookie(securityProperties.getCookie().getCsrfName(), csrfToken, false,
                securityProperties.getSession().getTtl()));
    }

    public void setVisitorCookie(HttpServletResponse response, String signedVisitorId) {
        addCookieHeader(response, buildCookie(securityProperties.getCookie().getVisitorName(), signedVisitorId, true,
                securityProperties.getVisitor().getTtl()));
    }

    /**
     * 访客 Cookie 保留
     */
    public void clearSessionCookies(HttpServletResponse response) {
        PlatformSecurityProperties.Cookie cookie = securityProperties.getCookie();
        addCookieHeader(response, buildCookie(cookie.getSessionName(), "", true, Duration.ZERO));
        addCookieHeader(response, buildCookie(cookie.getCsrfName(), "", false, Duration.ZERO));
    }

    public String readSessionToken(HttpServletRequest request) {
        return getCookieValue(request, securityProperties.getCookie().getSessionName());
    }

    public String readCsrfToken(HttpServletRequest request) {
        return getCookieValue(request, securityProperties.getCookie().getCsrfName());
    }

    public String readVisitorCookie(HttpServletRequest request) {
        return getCookieValue(request, securityProperties.getCookie().getVisitorName());
    }

    private ResponseCookie buildCookie(String name, String value, boolean httpOnly, Duration maxAge) {
        PlatformSecurityProperties.Cookie cookie = securityProperties.getCookie();
        return ResponseCookie.from(name, value)
                .httpOnly(httpOnly)
                .secure(cookie.isSecure())
                .path("/")
                .maxAge(maxAge)
                .sameSite(cookie.getSameSite())
                .build();
    }

    private void addCookieHeader(HttpServletResponse response, ResponseCookie cookie) {
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    static String getCookieValue(HttpServletRequest request, String name) {
        if (request == null || name == null) {
            return null;
        }
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName())) {
                String value = cookie.getValue();
                return value == null || value.isBlank() ? null : value;
            }
        }
        return null;
    }
}
