package com.sunny.procurehub.platform.security.ratelimit;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import com.sunny.procurehub.platform.exception.auth.RateLimitedException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis 限流器
 * 多节点共享计数，窗口由 key 过期时间界定
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "security.rate-limit", name = "store", havingValue = "redis")
public class RedisRateLimiter implements RateLimiter {

    private static final String KEY_PREFIX = "procurehub:rate:";

    private final StringRedisTemplate stringRedisTemplate;
    private final PlatformSecurityProperties securityProperties;

    public RedisRateLimiter(StringRedisTemplate stringRedisTemplate, PlatformSecurityProperties securityProperties) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.securityProperties = securityProperties;
    }

    @Override
    public void acquire(RateLimitRoute route, String clientIp) {
        Duration window = route.window(securityProperties);
        String key = KEY_PREFIX + route.getKey() + ":" + (clientIp == null ? "unknown" : clientIp);

        Long count = stringRedisTemplate.opsForValue().increment(key);
        if (count != null && count == 1L) {
            stringRedisTemplate.expire(key, window);
        }
        if (count != null && count > route.limit(securityProperties)) {
            Long ttl = stringRedisTemplate.getExpire(key, TimeUnit.SECONDS);
            long retryAfterSeconds = ttl == null || ttl <= 0 ? window.toSeconds() : ttl;
            log.warn("security_event event=rate_limited route={} clientIp={} retryAfterSeconds={}",
                    route.getKey(), clientIp, retryAfterSeconds);
            throw new RateLimitedException(retryAfterSeconds);
        }
    }
}
