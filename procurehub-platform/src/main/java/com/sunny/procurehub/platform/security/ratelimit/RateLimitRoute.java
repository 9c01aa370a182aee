package com.sunny.procurehub.platform.security.ratelimit;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import java.time.Duration;

/**
 * 限流路由
 * 配置项 security.rate-limit.routes.{key} 可覆盖默认阈值
 *
 * @author Sunny
 * @date 2026-03-02
 */
public enum RateLimitRoute {

    LOGIN("login", 5, Duration.ofSeconds(60)),
    REGISTER("register", 3, Duration.ofSeconds(60)),
    INVITE_VALIDATE("invite-validate", 5, Duration.ofSeconds(60)),
    VERIFY_EMAIL("verify-email", 3, Duration.ofSeconds(60));

    private final String key;
    private final int defaultLimit;
    private final Duration defaultWindow;

    RateLimitRoute(String key, int defaultLimit, Duration defaultWindow) {
        this.key = key;
        this.defaultLimit = defaultLimit;
        this.defaultWindow = defaultWindow;
    }

    public String getKey() {
        return key;
    }

    public int limit(PlatformSecurityProperties properties) {
        PlatformSecurityProperties.Rule rule = properties.getRateLimit().getRoutes().get(key);
        return rule != null && rule.getLimit() > 0 ? rule.getLimit() : defaultLimit;
    }

    public Duration window(PlatformSecurityProperties properties) {
        PlatformSecurityProperties.Rule rule = properties.getRateLimit().getRoutes().get(key);
        return rule != null && rule.getWindow() != null ? rule.getWindow() : defaultWindow;
    }
}
