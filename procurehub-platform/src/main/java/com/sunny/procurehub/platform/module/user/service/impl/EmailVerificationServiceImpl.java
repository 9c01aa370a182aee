package com.sunny.procurehub.platform.module.user.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.sunny.procurehub.common.exception.NotFoundException;
import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import com.sunny.procurehub.platform.exception.auth.VerificationTokenInvalidException;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.user.entity.User;
import com.sunny.procurehub.platform.module.user.entity.VerificationToken;
import com.sunny.procurehub.platform.module.user.event.EmailVerificationIssuedEvent;
import com.sunny.procurehub.platform.module.user.mapper.UserMapper;
import com.sunny.procurehub.platform.module.user.mapper.VerificationTokenMapper;
import com.sunny.procurehub.platform.module.user.service.EmailVerificationService;
import com.sunny.procurehub.platform.security.TokenGenerator;
import com.sunny.procurehub.platform.security.ratelimit.RateLimitRoute;
import com.sunny.procurehub.platform.security.ratelimit.RateLimiter;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 邮箱验证服务实现
 * 每个用户只保留最新一枚令牌，投递由 EmailVerificationIssuedEvent 的监听方负责
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailVerificationServiceImpl implements EmailVerificationService {

    private final VerificationTokenMapper verificationTokenMapper;
    private final UserMapper userMapper;
    private final TokenGenerator tokenGenerator;
    private final TransactionExecutor transactionExecutor;
    private final RateLimiter rateLimiter;
    private final ApplicationEventPublisher eventPublisher;
    private final PlatformSecurityProperties securityProperties;
    private final Clock clock;

    @Override
    public String issue(Long userId) {
        return transactionExecutor.execute(DbScene.GENERIC, () -> {
            User user = userMapper.selectById(userId);
            if (user == null) {
                throw new NotFoundException("用户不存在: %s", userId);
            }
            LambdaQueryWrapper<VerificationToken> previous = new LambdaQueryWrapper<>();
            previous.eq(VerificationToken::getUserId, userId);
            verificationTokenMapper.delete(previous);

            LocalDateTime now = LocalDateTime.now(clock);
            String rawToken = tokenGenerator.randomToken();
            VerificationToken token = new VerificationToken();
            token.setUserId(userId);
            token.setTokenHash(TokenGenerator.sha256Hex(rawToken));
            token.setCreatedAt(now);
            token.setExpiresAt(now.plus(securityProperties.getVerification().getTtl()));
            verificationTokenMapper.insert(token);

            eventPublisher.publishEvent(
                    new EmailVerificationIssuedEvent(userId, user.getEmail(), rawToken, token.getExpiresAt()));
            log.info("security_event event=verification_issued userId={}", userId);
            return rawToken;
        });
    }

    @Override
    public void verify(String rawToken, String clientIp) {
        rateLimiter.acquire(RateLimitRoute.VERIFY_EMAIL, clientIp);
        if (!StringUtils.hasText(rawToken)) {
            throw new VerificationTokenInvalidException();
        }
        String tokenHash = TokenGenerator.sha256Hex(rawToken.trim());

        transactionExecutor.run(DbScene.GENERIC, () -> {
            LambdaQueryWrapper<VerificationToken> query = new LambdaQueryWrapper<>();
            query.eq(VerificationToken::getTokenHash, tokenHash);
            VerificationToken token = verificationTokenMapper.selectOne(query);
            LocalDateTime now = LocalDateTime.now(clock);
            if (token == null) {
                log.warn("security_event event=verification_failed reason=not_found ip={}", clientIp);
                throw new VerificationTokenInvalidException();
            }
            if (!token.getExpiresAt().isAfter(now)) {
                log.warn("security_event event=verification_failed reason=expired userId={} ip={}",
                        token.getUserId(), clientIp);
                throw new VerificationTokenInvalidException();
            }

            LambdaUpdateWrapper<User> update = new LambdaUpdateWrapper<>();
            update.eq(User::getId, token.getUserId())
                    .isNull(User::getEmailVerifiedAt)
                    .set(User::getEmailVerifiedAt, now)
                    .set(User::getUpdatedAt, now);
            int updated = userMapper.update(null, update);
            verificationTokenMapper.deleteById(token.getId());
            log.info("security_event event=email_verified userId={} firstTime={}", token.getUserId(), updated > 0);
        });
    }
}
