package com.sunny.procurehub.platform.security.ratelimit;

/**
 * 限流器
 * 按 (路由, 客户端IP) 固定窗口计数，超过阈值抛出 RateLimitedException
 *
 * @author Sunny
 * @date 2026-03-02
 */
public interface RateLimiter {

    void acquire(RateLimitRoute route, String clientIp);
}
