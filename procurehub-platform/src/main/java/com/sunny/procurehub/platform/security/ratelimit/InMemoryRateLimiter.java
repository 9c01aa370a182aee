package com.sunny.procurehub.platform.security.ratelimit;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import com.sunny.procurehub.platform.exception.auth.RateLimitedException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 进程内限流器
 * 单节点部署使用；多节点部署切换为 redis 实现
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "security.rate-limit", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRateLimiter implements RateLimiter {

    private static final int EVICTION_THRESHOLD = 10_000;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final PlatformSecurityProperties securityProperties;
    private final Clock clock;

    public InMemoryRateLimiter(PlatformSecurityProperties securityProperties, Clock clock) {
        this.securityProperties = securityProperties;
        this.clock = clock;
    }

    @Override
    public void acquire(RateLimitRoute route, String clientIp) {
        long now = clock.millis();
        long windowMillis = route.window(securityProperties).toMillis();
        int limit = route.limit(securityProperties);
        String key = route.getKey() + ":" + (clientIp == null ? "unknown" : clientIp);

        Window window = windows.compute(key, (ignored, current) -> {
            if (current == null || now - current.startedAt() >= windowMillis) {
                return new Window(now, 1);
            }
            return new Window(current.startedAt(), current.count() + 1);
        });

        if (windows.size() > EVICTION_THRESHOLD) {
            windows.entrySet().removeIf(entry -> now - entry.getValue().startedAt() >= windowMillis);
        }

        if (window.count() > limit) {
            long retryAfterMillis = window.startedAt() + windowMillis - now;
            long retryAfterSeconds = Math.max(1L, (retryAfterMillis + 999L) / 1000L);
            log.warn("security_event event=rate_limited route={} clientIp={} retryAfterSeconds={}",
                    route.getKey(), clientIp, retryAfterSeconds);
            throw new RateLimitedException(retryAfterSeconds);
        }
    }

    private record Window(long startedAt, int count) {
    }
}
