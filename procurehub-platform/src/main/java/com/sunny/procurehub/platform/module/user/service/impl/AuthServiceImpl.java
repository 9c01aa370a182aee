package com.sunny.procurehub.platform.module.user.service.impl;

import com.sunny.procurehub.platform.exception.auth.EmailTakenException;
import com.sunny.procurehub.platform.exception.auth.InvalidCredentialsException;
import com.sunny.procurehub.platform.exception.auth.InvalidInputException;
import com.sunny.procurehub.platform.exception.invite.InviteInvalidException;
import com.sunny.procurehub.platform.exception.invite.InviteRaceLostException;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.invite.dto.InviteDto;
import com.sunny.procurehub.platform.module.invite.entity.Invite;
import com.sunny.procurehub.platform.module.invite.enums.ConsumeOutcome;
import com.sunny.procurehub.platform.module.invite.enums.InviteRejection;
import com.sunny.procurehub.platform.module.invite.service.InvitePolicy;
import com.sunny.procurehub.platform.module.invite.service.InviteService;
import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import com.sunny.procurehub.platform.module.organization.service.OrganizationService;
import com.sunny.procurehub.platform.module.permission.AuthStatus;
import com.sunny.procurehub.platform.module.permission.PermissionSet;
import com.sunny.procurehub.platform.module.user.dto.AuthDto;
import com.sunny.procurehub.platform.module.user.entity.Profile;
import com.sunny.procurehub.platform.module.user.entity.User;
import com.sunny.procurehub.platform.module.user.entity.UserSession;
import com.sunny.procurehub.platform.module.user.mapper.ProfileMapper;
import com.sunny.procurehub.platform.module.user.mapper.UserMapper;
import com.sunny.procurehub.platform.module.user.service.AuthService;
import com.sunny.procurehub.platform.module.user.service.EmailVerificationService;
import com.sunny.procurehub.platform.module.user.service.SessionService;
import com.sunny.procurehub.platform.module.user.service.VisitorService;
import com.sunny.procurehub.platform.security.AuthContext;
import com.sunny.procurehub.platform.security.CredentialValidator;
import com.sunny.procurehub.platform.security.TimingEqualizer;
import com.sunny.procurehub.platform.security.TokenGenerator;
import com.sunny.procurehub.platform.security.VisitorIdSigner;
import com.sunny.procurehub.platform.security.ratelimit.RateLimitRoute;
import com.sunny.procurehub.platform.security.ratelimit.RateLimiter;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 认证服务实现
 * 负责注册、登录、登出与当前会话视图
 *
 * <p>注册与登录全程包裹在计时下限内，失败原因只写服务端日志。
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    private static final String INITIAL_ONBOARDING_STEP = "welcome";

    private final UserMapper userMapper;
    private final ProfileMapper profileMapper;
    private final SessionService sessionService;
    private final InviteService inviteService;
    private final OrganizationService organizationService;
    private final EmailVerificationService emailVerificationService;
    private final VisitorService visitorService;
    private final TransactionExecutor transactionExecutor;
    private final CredentialValidator credentialValidator;
    private final PasswordEncoder passwordEncoder;
    private final TokenGenerator tokenGenerator;
    private final VisitorIdSigner visitorIdSigner;
    private final RateLimiter rateLimiter;
    private final TimingEqualizer timingEqualizer;
    private final Clock clock;

    @Override
    public AuthDto.AuthResult register(AuthDto.Register dto, String clientIp, String visitorCookie) {
        return timingEqualizer.equalize(() -> doRegister(dto, clientIp, visitorCookie));
    }

    @Override
    public AuthDto.AuthResult login(AuthDto.Login dto, String clientIp, String visitorCookie) {
        return timingEqualizer.equalize(() -> doLogin(dto, clientIp, visitorCookie));
    }

    @Override
    public void logout(String sessionToken) {
        sessionService.destroySession(sessionToken);
        log.info("security_event event=logout hadSession={}", StringUtils.hasText(sessionToken));
    }

    @Override
    public AuthDto.SessionResult currentSession(AuthContext context, String visitorCookie, String csrfCookie) {
        AuthDto.SessionResult result = new AuthDto.SessionResult();
        AuthDto.SessionView view = new AuthDto.SessionView();
        result.setView(view);

        Optional<String> visitorId = visitorIdSigner.verify(visitorCookie);
        if (visitorId.isPresent()) {
            view.setVisitorId(visitorId.get());
        } else {
            String minted = visitorIdSigner.mint();
            view.setVisitorId(minted);
            result.setSignedVisitorId(visitorIdSigner.sign(minted));
        }

        if (context == null) {
            view.setAuthenticated(false);
            view.setStatus(AuthStatus.ANONYMOUS.getCode());
            view.setPermissions(PermissionSet.ANONYMOUS);
            return result;
        }

        User user = userMapper.selectById(context.userId());
        Profile profile = profileMapper.selectById(context.userId());
        view.setAuthenticated(true);
        view.setStatus(context.status().getCode());
        view.setUser(toUserView(user));
        view.setProfile(toProfileView(profile));
        view.setPermissions(context.permissions());
        view.setCompanyId(context.companyId());
        view.setRole(context.role() == null ? null : context.role().getCode());

        String csrfToken = csrfCookie;
        if (!StringUtils.hasText(csrfToken)) {
            csrfToken = tokenGenerator.randomToken();
            result.setCsrfToken(csrfToken);
        }
        view.setCsrfToken(csrfToken);
        return result;
    }

    private AuthDto.AuthResult doRegister(AuthDto.Register dto, String clientIp, String visitorCookie) {
        rateLimiter.acquire(RateLimitRoute.REGISTER, clientIp);
        if (dto == null) {
            throw new InvalidInputException("参数错误");
        }

        String code = InvitePolicy.normalizeCode(dto.getInviteCode());
        if (!InvitePolicy.isValidCodeFormat(code)) {
            logRegisterRejected("invite_invalid_format", dto.getEmail(), clientIp);
            throw new InviteInvalidException(InviteRejection.INVALID_FORMAT);
        }

        String email = CredentialValidator.normalizeEmail(dto.getEmail());
        if (!credentialValidator.isValidEmail(email)) {
            throw new InvalidInputException("邮箱格式不正确");
        }
        Optional<String> passwordProblem = credentialValidator.checkPassword(dto.getPassword());
        if (passwordProblem.isPresent()) {
            throw new InvalidInputException(passwordProblem.get());
        }

        Invite invite = inviteService.findByCode(code).orElse(null);
        if (invite == null) {
            logRegisterRejected("invite_not_found", email, clientIp);
            throw new InviteInvalidException(InviteRejection.NOT_FOUND);
        }
        Optional<InviteRejection> rejection = InvitePolicy.canUse(invite, email, LocalDateTime.now(clock));
        if (rejection.isPresent()) {
            logRegisterRejected("invite_" + rejection.get().getCode(), email, clientIp);
            throw new InviteInvalidException(rejection.get());
        }

        if (userMapper.selectByEmail(email) != null) {
            logRegisterRejected("email_taken", email, clientIp);
            throw new EmailTakenException();
        }

        // 哈希计算较慢，放在事务外
        String passwordHash = passwordEncoder.encode(dto.getPassword());
        Optional<InviteDto.CompanyTarget> companyTarget = inviteService.companyTarget(invite);
        Optional<String> carriedVisitorId = visitorIdSigner.verify(visitorCookie);

        Registration registration;
        try {
            registration = transactionExecutor.execute(DbScene.USER_REGISTER, () -> {
                LocalDateTime now = LocalDateTime.now(clock);
                User user = new User();
                user.setEmail(email);
                user.setPasswordHash(passwordHash);
                user.setInvitedBy(invite.getInviterId());
                user.setInviteId(invite.getId());
                user.setCreatedAt(now);
                user.setUpdatedAt(now);
                userMapper.insert(user);

                Profile profile = new Profile();
                profile.setUserId(user.getId());
                profile.setDisplayName(StringUtils.hasText(dto.getDisplayName()) ? dto.getDisplayName().trim() : null);
                profile.setReputation(0);
                profile.setInviteSlots(0);
                profile.setCurrentStreak(0);
                profile.setLongestStreak(0);
                profile.setOnboardingStep(INITIAL_ONBOARDING_STEP);
                profile.setCreatedAt(now);
                profile.setUpdatedAt(now);
                profileMapper.insert(profile);

                companyTarget.ifPresent(target -> organizationService.addMember(
                        target.companyId(), user.getId(), target.teamId(), OrgRole.MEMBER));

                UserSession session = sessionService.createSession(user.getId());

                if (inviteService.atomicConsume(invite.getId(), user.getId()) == ConsumeOutcome.LOST_RACE) {
                    throw new InviteRaceLostException();
                }
                carriedVisitorId.ifPresent(visitorId -> visitorService.claimVisitor(visitorId, user.getId()));
                emailVerificationService.issue(user.getId());
                return new Registration(user, profile, session);
            });
        } catch (InviteRaceLostException ex) {
            log.warn("security_event event=register_invite_race_lost inviteId={} email={} ip={}",
                    invite.getId(), CredentialValidator.maskEmail(email), clientIp);
            throw ex;
        }

        log.info("security_event event=register_success userId={} inviteId={} inviteType={} ip={}",
                registration.user().getId(), invite.getId(), invite.getInviteType().getCode(), clientIp);
        return buildResult(registration.user(), registration.profile(), registration.session(),
                carriedVisitorId.orElseGet(visitorIdSigner::mint));
    }

    private AuthDto.AuthResult doLogin(AuthDto.Login dto, String clientIp, String visitorCookie) {
        rateLimiter.acquire(RateLimitRoute.LOGIN, clientIp);
        String rawEmail = dto == null ? null : dto.getEmail();
        String email = CredentialValidator.normalizeEmail(rawEmail);
        if (!credentialValidator.isValidEmail(email)) {
            throw loginFailed("invalid_email_format", email, clientIp);
        }
        if (!StringUtils.hasText(dto.getPassword())) {
            throw loginFailed("missing_password", email, clientIp);
        }
        User user = userMapper.selectByEmail(email);
        if (user == null) {
            throw loginFailed("user_not_found", email, clientIp);
        }
        if (!StringUtils.hasText(user.getPasswordHash())) {
            throw loginFailed("missing_verifier", email, clientIp);
        }
        if (!passwordEncoder.matches(dto.getPassword(), user.getPasswordHash())) {
            throw loginFailed("wrong_password", email, clientIp);
        }

        Optional<String> carriedVisitorId = visitorIdSigner.verify(visitorCookie);
        UserSession session = transactionExecutor.execute(DbScene.SESSION, () -> {
            UserSession created = sessionService.createSession(user.getId());
            carriedVisitorId.ifPresent(visitorId -> visitorService.claimVisitor(visitorId, user.getId()));
            return created;
        });
        Profile profile = profileMapper.selectById(user.getId());

        log.info("security_event event=login_success userId={} ip={}", user.getId(), clientIp);
        return buildResult(user, profile, session, carriedVisitorId.orElseGet(visitorIdSigner::mint));
    }

    private InvalidCredentialsException loginFailed(String reason, String email, String clientIp) {
        log.warn("security_event event=login_failed reason={} email={} ip={}",
                reason, CredentialValidator.maskEmail(email), clientIp);
        return new InvalidCredentialsException();
    }

    private void logRegisterRejected(String reason, String email, String clientIp) {
        log.warn("security_event event=register_rejected reason={} email={} ip={}",
                reason, CredentialValidator.maskEmail(CredentialValidator.normalizeEmail(email)), clientIp);
    }

    private AuthDto.AuthResult buildResult(User user, Profile profile, UserSession session, String visitorId) {
        AuthDto.AuthResult result = new AuthDto.AuthResult();
        result.setSessionToken(session.getToken());
        result.setCsrfToken(tokenGenerator.randomToken());
        result.setSignedVisitorId(visitorIdSigner.sign(visitorId));
        result.setUser(toUserView(user));
        result.setProfile(toProfileView(profile));
        return result;
    }

    private AuthDto.UserView toUserView(User user) {
        if (user == null) {
            return null;
        }
        AuthDto.UserView view = new AuthDto.UserView();
        view.setId(user.getId());
        view.setEmail(user.getEmail());
        view.setEmailVerified(user.isEmailVerified());
        view.setCreatedAt(user.getCreatedAt());
        return view;
    }

    private AuthDto.ProfileView toProfileView(Profile profile) {
        if (profile == null) {
            return null;
        }
        AuthDto.ProfileView view = new AuthDto.ProfileView();
        view.setDisplayName(profile.getDisplayName());
        view.setReputation(profile.getReputation());
        view.setInviteSlots(profile.getInviteSlots());
        view.setCurrentStreak(profile.getCurrentStreak());
        view.setLongestStreak(profile.getLongestStreak());
        view.setOnboardingStep(profile.getOnboardingStep());
        return view;
    }

    private record Registration(User user, Profile profile, UserSession session) {
    }
}
