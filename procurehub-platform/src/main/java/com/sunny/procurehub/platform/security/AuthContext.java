package com.sunny.procurehub.platform.security;

import com.sunny.procurehub.platform.exception.auth.UnauthenticatedException;
import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import com.sunny.procurehub.platform.module.permission.AuthStatus;
import com.sunny.procurehub.platform.module.permission.PermissionSet;
import jakarta.servlet.http.HttpServletRequest;

/**
 * 请求认证上下文
 * 会话拦截器每个请求解析一次，以请求属性传递给处理器
 *
 * @author Sunny
 * @date 2026-03-02
 */
public record AuthContext(
        Long sessionId,
        Long userId,
        String email,
        AuthStatus status,
        Long companyId,
        Long teamId,
        OrgRole role,
        int reputation,
        PermissionSet permissions) {

    public static final String REQUEST_ATTRIBUTE = AuthContext.class.getName();

    public boolean isAdminOrOwner() {
        return role != null && role.isAdminOrOwner();
    }

    public static void attach(HttpServletRequest request, AuthContext context) {
        if (request == null) {
            return;
        }
        request.setAttribute(REQUEST_ATTRIBUTE, context);
    }

    public static AuthContext current(HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        Object value = request.getAttribute(REQUEST_ATTRIBUTE);
        if (value instanceof AuthContext context) {
            return context;
        }
        return null;
    }

    public static AuthContext require(HttpServletRequest request) {
        AuthContext context = current(request);
        if (context == null) {
            throw new UnauthenticatedException();
        }
        return context;
    }
}
