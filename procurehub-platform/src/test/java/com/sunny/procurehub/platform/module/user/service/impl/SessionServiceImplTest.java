package com.sunny.procurehub.platform.module.user.service.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import com.sunny.procurehub.platform.exception.auth.UnauthenticatedException;
import com.sunny.procurehub.platform.module.organization.entity.CompanyMember;
import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import com.sunny.procurehub.platform.module.organization.service.OrganizationService;
import com.sunny.procurehub.platform.module.permission.AuthStatus;
import com.sunny.procurehub.platform.module.permission.PermissionResolver;
import com.sunny.procurehub.platform.module.user.entity.Profile;
import com.sunny.procurehub.platform.module.user.entity.User;
import com.sunny.procurehub.platform.module.user.entity.UserSession;
import com.sunny.procurehub.platform.module.user.mapper.ProfileMapper;
import com.sunny.procurehub.platform.module.user.mapper.UserMapper;
import com.sunny.procurehub.platform.module.user.mapper.UserSessionMapper;
import com.sunny.procurehub.platform.security.AuthContext;
import com.sunny.procurehub.platform.security.TokenGenerator;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionServiceImplTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private UserSessionMapper userSessionMapper;
    @Mock
    private UserMapper userMapper;
    @Mock
    private ProfileMapper profileMapper;
    @Mock
    private OrganizationService organizationService;

    private SessionServiceImpl sessionService;

    @BeforeEach
    void setUp() {
        PlatformSecurityProperties properties = new PlatformSecurityProperties();
        sessionService = new SessionServiceImpl(userSessionMapper, userMapper, profileMapper, organizationService,
                new PermissionResolver(properties), new TokenGenerator(), properties, CLOCK);
    }

    @Test
    void createSession_shouldIssueRandomTokenWithThirtyDayExpiry() {
        UserSession session = sessionService.createSession(7L);

        ArgumentCaptor<UserSession> captor = ArgumentCaptor.forClass(UserSession.class);
        verify(userSessionMapper).insert(captor.capture());
        assertEquals(7L, captor.getValue().getUserId());
        assertEquals(NOW.plusDays(30), session.getExpiresAt());
        assertEquals(43, session.getToken().length());
    }

    @Test
    void resolve_shouldReturnEmptyForBlankToken() {
        assertTrue(sessionService.resolve(" ").isEmpty());
        verifyNoInteractions(userSessionMapper);
    }

    @Test
    void resolve_shouldTreatExpiryEqualToNowAsExpired() {
        when(userSessionMapper.selectOne(any(LambdaQueryWrapper.class))).thenReturn(session("tok", NOW));

        assertTrue(sessionService.resolve("tok").isEmpty());
        verify(userMapper, never()).selectById(any());
    }

    @Test
    void resolve_shouldBuildContextWithMembershipAndPermissions() {
        when(userSessionMapper.selectOne(any(LambdaQueryWrapper.class)))
                .thenReturn(session("tok", NOW.plusHours(1)));
        User user = new User();
        user.setId(7L);
        user.setEmail("buyer@example.com");
        user.setEmailVerifiedAt(NOW.minusDays(1));
        when(userMapper.selectById(7L)).thenReturn(user);
        Profile profile = new Profile();
        profile.setReputation(120);
        profile.setInviteSlots(2);
        when(profileMapper.selectById(7L)).thenReturn(profile);
        CompanyMember member = new CompanyMember();
        member.setCompanyId(3L);
        member.setTeamId(4L);
        member.setMemberRole(OrgRole.APPROVER);
        when(organizationService.findMembership(eq(7L))).thenReturn(Optional.of(member));

        AuthContext context = sessionService.resolve("tok").orElseThrow();

        assertEquals(AuthStatus.VERIFIED, context.status());
        assertEquals(3L, context.companyId());
        assertEquals(OrgRole.APPROVER, context.role());
        assertEquals(120, context.reputation());
    }

    @Test
    void validateSession_shouldThrowWhenSessionUnknown() {
        when(userSessionMapper.selectOne(any(LambdaQueryWrapper.class))).thenReturn(null);

        assertThrows(UnauthenticatedException.class, () -> sessionService.validateSession("missing"));
    }

    @Test
    void destroySession_shouldIgnoreMissingToken() {
        sessionService.destroySession(null);

        verifyNoInteractions(userSessionMapper);
    }

    private UserSession session(String token, LocalDateTime expiresAt) {
        UserSession session = new UserSession();
        session.setId(1L);
        session.setUserId(7L);
        session.setToken(token);
        session.setExpiresAt(expiresAt);
        return session;
    }
}
