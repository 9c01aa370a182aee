package com.sunny.procurehub.platform.module.user.event;

import java.time.LocalDateTime;

/**
 * 邮箱验证令牌已签发
 * 投递方监听该事件发送验证邮件；rawToken 不得写入日志
 *
 * @author Sunny
 * @date 2026-03-02
 */
public record EmailVerificationIssuedEvent(Long userId, String email, String rawToken, LocalDateTime expiresAt) {

    @Override
    public String toString() {
        return "EmailVerificationIssuedEvent[userId=" + userId + ", expiresAt=" + expiresAt + "]";
    }
}
