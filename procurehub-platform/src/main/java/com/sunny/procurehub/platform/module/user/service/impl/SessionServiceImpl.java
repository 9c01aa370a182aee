package com.sunny.procurehub.platform.module.user.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import com.sunny.procurehub.platform.exception.auth.UnauthenticatedException;
import com.sunny.procurehub.platform.module.organization.entity.CompanyMember;
import com.sunny.procurehub.platform.module.organization.service.OrganizationService;
import com.sunny.procurehub.platform.module.permission.AuthStatus;
import com.sunny.procurehub.platform.module.permission.PermissionResolver;
import com.sunny.procurehub.platform.module.permission.PermissionSet;
import com.sunny.procurehub.platform.module.user.entity.Profile;
import com.sunny.procurehub.platform.module.user.entity.User;
import com.sunny.procurehub.platform.module.user.entity.UserSession;
import com.sunny.procurehub.platform.module.user.mapper.ProfileMapper;
import com.sunny.procurehub.platform.module.user.mapper.UserMapper;
import com.sunny.procurehub.platform.module.user.mapper.UserSessionMapper;
import com.sunny.procurehub.platform.module.user.service.SessionService;
import com.sunny.procurehub.platform.security.AuthContext;
import com.sunny.procurehub.platform.security.TokenGenerator;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 会话服务实现
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionServiceImpl implements SessionService {

    private final UserSessionMapper userSessionMapper;
    private final UserMapper userMapper;
    private final ProfileMapper profileMapper;
    private final OrganizationService organizationService;
    private final PermissionResolver permissionResolver;
    private final TokenGenerator tokenGenerator;
    private final PlatformSecurityProperties securityProperties;
    private final Clock clock;

    @Override
    public UserSession createSession(Long userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        UserSession session = new UserSession();
        session.setUserId(userId);
        session.setToken(tokenGenerator.randomToken());
        session.setCreatedAt(now);
        session.setExpiresAt(now.plus(securityProperties.getSession().getTtl()));
        userSessionMapper.insert(session);
        return session;
    }

    @Override
    public Optional<AuthContext> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        UserSession session = findByToken(token);
        if (session == null || !TokenGenerator.constantTimeEquals(session.getToken(), token)) {
            return Optional.empty();
        }
        if (!session.getExpiresAt().isAfter(LocalDateTime.now(clock))) {
            log.info("security_event event=session_expired sessionId={} userId={}", session.getId(), session.getUserId());
            return Optional.empty();
        }
        User user = userMapper.selectById(session.getUserId());
        if (user == null) {
            return Optional.empty();
        }
        Profile profile = profileMapper.selectById(user.getId());
        Optional<CompanyMember> membership = organizationService.findMembership(user.getId());

        AuthStatus status = user.isEmailVerified() ? AuthStatus.VERIFIED : AuthStatus.AUTHENTICATED;
        int reputation = profile == null || profile.getReputation() == null ? 0 : profile.getReputation();
        int inviteSlots = profile == null || profile.getInviteSlots() == null ? 0 : profile.getInviteSlots();
        PermissionSet permissions = permissionResolver.resolve(status, reputation, inviteSlots,
                membership.map(CompanyMember::getMemberRole).orElse(null));

        return Optional.of(new AuthContext(
                session.getId(),
                user.getId(),
                user.getEmail(),
                status,
                membership.map(CompanyMember::getCompanyId).orElse(null),
                membership.map(CompanyMember::getTeamId).orElse(null),
                membership.map(CompanyMember::getMemberRole).orElse(null),
                reputation,
                permissions));
    }

    @Override
    public AuthContext validateSession(String token) {
        return resolve(token).orElseThrow(UnauthenticatedException::new);
    }

    @Override
    public void destroySession(String token) {
        if (token == null || token.isBlank()) {
            return;
        }
        LambdaQueryWrapper<UserSession> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(UserSession::getToken, token);
        userSessionMapper.delete(wrapper);
    }

    @Override
    public int purgeExpired() {
        LambdaQueryWrapper<UserSession> wrapper = new LambdaQueryWrapper<>();
        wrapper.le(UserSession::getExpiresAt, LocalDateTime.now(clock));
        int purged = userSessionMapper.delete(wrapper);
        if (purged > 0) {
            log.info("security_event event=sessions_purged count={}", purged);
        }
        return purged;
    }

    private UserSession findByToken(String token) {
        LambdaQueryWrapper<UserSession> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(UserSession::getToken, token);
        return userSessionMapper.selectOne(wrapper);
    }
}
