package com.sunny.procurehub.platform.exception.auth;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.TooManyRequestsException;
import java.util.Map;

/**
 * 限流异常
 * 上下文携带 retryAfterSeconds
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class RateLimitedException extends TooManyRequestsException {

    private final long retryAfterSeconds;

    public RateLimitedException(long retryAfterSeconds) {
        super(ErrorType.RATE_LIMITED,
                Map.of("retryAfterSeconds", String.valueOf(retryAfterSeconds)),
                "请求过于频繁，请稍后重试");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
