package com.sunny.procurehub.platform.security;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 凭证类操作计时下限
 * 成功与各类失败分支都至少耗时 security.timing.floor 后才返回
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Component
@RequiredArgsConstructor
public class TimingEqualizer {

    private final PlatformSecurityProperties securityProperties;

    public <T> T equalize(Supplier<T> operation) {
        long startedAt = System.nanoTime();
        try {
            return operation.get();
        } finally {
            waitForFloor(startedAt);
        }
    }

    private void waitForFloor(long startedAt) {
        Duration floor = securityProperties.getTiming().getFloor();
        if (floor == null || floor.isZero() || floor.isNegative()) {
            return;
        }
        long remainingNanos = floor.toNanos() - (System.nanoTime() - startedAt);
        if (remainingNanos <= 0) {
            return;
        }
        try {
            Thread.sleep(remainingNanos / 1_000_000L, (int) (remainingNanos % 1_000_000L));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
