package com.sunny.procurehub.platform.module.invite.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.procurehub.common.exception.ForbiddenException;
import com.sunny.procurehub.common.exception.InternalException;
import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import com.sunny.procurehub.platform.exception.auth.InvalidInputException;
import com.sunny.procurehub.platform.exception.invite.InviteSlotsExhaustedException;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.invite.dto.InviteDto;
import com.sunny.procurehub.platform.module.invite.entity.Invite;
import com.sunny.procurehub.platform.module.invite.entity.InviteUse;
import com.sunny.procurehub.platform.module.invite.enums.ConsumeOutcome;
import com.sunny.procurehub.platform.module.invite.enums.InviteRejection;
import com.sunny.procurehub.platform.module.invite.enums.InviteType;
import com.sunny.procurehub.platform.module.invite.mapper.InviteMapper;
import com.sunny.procurehub.platform.module.invite.mapper.InviteUseMapper;
import com.sunny.procurehub.platform.module.invite.service.InvitePolicy;
import com.sunny.procurehub.platform.module.invite.service.InviteService;
import com.sunny.procurehub.platform.module.organization.entity.CompanyMember;
import com.sunny.procurehub.platform.module.organization.service.OrganizationService;
import com.sunny.procurehub.platform.module.user.entity.Profile;
import com.sunny.procurehub.platform.module.user.mapper.ProfileMapper;
import com.sunny.procurehub.platform.security.CredentialValidator;
import com.sunny.procurehub.platform.security.TimingEqualizer;
import com.sunny.procurehub.platform.security.ratelimit.RateLimitRoute;
import com.sunny.procurehub.platform.security.ratelimit.RateLimiter;
import com.sunny.procurehub.platform.storage.InsertResult;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 邀请服务实现
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InviteServiceImpl implements InviteService {

    private static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    // 36 * 7，超出部分丢弃以消除取模偏差
    private static final int SAMPLE_BOUND = 252;
    private static final int MAX_CODE_ATTEMPTS = 5;
    private static final String SHARE_PATH_PREFIX = "/invite/";

    private final InviteMapper inviteMapper;
    private final InviteUseMapper inviteUseMapper;
    private final ProfileMapper profileMapper;
    private final OrganizationService organizationService;
    private final TransactionExecutor transactionExecutor;
    private final CredentialValidator credentialValidator;
    private final RateLimiter rateLimiter;
    private final TimingEqualizer timingEqualizer;
    private final PlatformSecurityProperties securityProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    @Override
    public Optional<Invite> findByCode(String normalizedCode) {
        if (!InvitePolicy.isValidCodeFormat(normalizedCode)) {
            return Optional.empty();
        }
        LambdaQueryWrapper<Invite> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(Invite::getCode, normalizedCode);
        return Optional.ofNullable(inviteMapper.selectOne(wrapper));
    }

    @Override
    public ConsumeOutcome atomicConsume(Long inviteId, Long userId) {
        return transactionExecutor.execute(DbScene.INVITE_CONSUME, () -> {
            Invite locked = inviteMapper.selectByIdForUpdate(inviteId);
            LocalDateTime now = LocalDateTime.now(clock);
            if (locked == null) {
                return ConsumeOutcome.LOST_RACE;
            }
            if ((locked.getExpiresAt() != null && !locked.getExpiresAt().isAfter(now)) || InvitePolicy.isUsedUp(locked)) {
                return ConsumeOutcome.LOST_RACE;
            }
            if (inviteMapper.incrementUseCount(inviteId) == 0) {
                return ConsumeOutcome.LOST_RACE;
            }

            InviteUse use = new InviteUse();
            use.setInviteId(inviteId);
            use.setUserId(userId);
            use.setUsedAt(now);
            inviteUseMapper.insert(use);
            return ConsumeOutcome.SUCCESS;
        });
    }

    @Override
    public InviteDto.CreateResponse createInvite(Long inviterId, InviteDto.Create dto) {
        if (inviterId == null || dto == null) {
            throw new InvalidInputException("参数错误");
        }
        InviteType type = parseType(dto.getType());
        Optional<CompanyMember> membership = organizationService.findMembership(inviterId);
        boolean privileged = membership.map(member -> member.getMemberRole().isAdminOrOwner()).orElse(false);

        Invite invite = new Invite();
        invite.setInviteType(type);
        invite.setInviterId(inviterId);
        invite.setUseCount(0);
        switch (type) {
            case DIRECT -> {
                String email = CredentialValidator.normalizeEmail(dto.getEmail());
                if (!credentialValidator.isValidEmail(email)) {
                    throw new InvalidInputException("邀请邮箱格式不正确");
                }
                invite.setEmail(email);
                invite.setMaxUses(1);
            }
            case LINK -> invite.setMaxUses(securityProperties.getInvite().getLinkMaxUses());
            case COMPANY -> {
                if (!privileged) {
                    throw new ForbiddenException("仅公司管理员可创建公司邀请");
                }
                if (dto.getMaxUses() == null) {
                    throw new InvalidInputException("公司邀请需要指定使用次数");
                }
                invite.setMaxUses(dto.getMaxUses());
                invite.setMetadata(writeCompanyTarget(membership.get().getCompanyId(), dto.getTeamId()));
            }
            default -> throw new InvalidInputException("邀请类型不合法");
        }

        return transactionExecutor.execute(DbScene.INVITE_CREATE, () -> {
            LocalDateTime now = LocalDateTime.now(clock);
            if (!privileged && profileMapper.decrementInviteSlot(inviterId, now) == 0) {
                throw new InviteSlotsExhaustedException();
            }
            invite.setCreatedAt(now);
            invite.setExpiresAt(now.plus(securityProperties.getInvite().getExpiry()));
            insertWithFreshCode(invite);

            Profile profile = profileMapper.selectById(inviterId);
            log.info("security_event event=invite_created inviteId={} inviterId={} type={} maxUses={}",
                    invite.getId(), inviterId, type.getCode(), invite.getMaxUses());

            InviteDto.CreateResponse response = new InviteDto.CreateResponse();
            response.setInviteId(invite.getId());
            response.setCode(invite.getCode());
            response.setType(type.getCode());
            response.setSharePath(SHARE_PATH_PREFIX + invite.getCode());
            response.setMaxUses(invite.getMaxUses());
            response.setExpiresAt(invite.getExpiresAt());
            response.setRemainingSlots(profile == null ? 0 : profile.getInviteSlots());
            return response;
        });
    }

    @Override
    public InviteDto.Validation validateInvite(String rawCode, String email, String clientIp) {
        return timingEqualizer.equalize(() -> {
            rateLimiter.acquire(RateLimitRoute.INVITE_VALIDATE, clientIp);

            String code = InvitePolicy.normalizeCode(rawCode);
            if (!InvitePolicy.isValidCodeFormat(code)) {
                return rejected(InviteRejection.INVALID_FORMAT);
            }
            Optional<Invite> found = findByCode(code);
            if (found.isEmpty()) {
                return rejected(InviteRejection.NOT_FOUND);
            }
            Invite invite = found.get();
            String normalizedEmail = CredentialValidator.normalizeEmail(email);
            Optional<InviteRejection> rejection = InvitePolicy.canUse(invite, normalizedEmail, LocalDateTime.now(clock));
            if (rejection.isPresent()) {
                return rejected(rejection.get());
            }

            InviteDto.Validation validation = new InviteDto.Validation();
            validation.setValid(true);
            validation.setType(invite.getInviteType().getCode());
            validation.setRestrictedEmail(invite.getInviteType() == InviteType.DIRECT ? invite.getEmail() : null);
            validation.setRemainingUses(invite.getMaxUses() - invite.getUseCount());
            if (invite.getInviterId() != null) {
                Profile inviter = profileMapper.selectById(invite.getInviterId());
                if (inviter != null) {
                    validation.setInviterDisplayName(
                            inviter.getDisplayName() == null ? "A member" : inviter.getDisplayName());
                }
            }
            return validation;
        });
    }

    @Override
    public IPage<Invite> listInvites(Long inviterId, int limit, int offset) {
        Page<Invite> page = Page.of(resolveCurrent(limit, offset), limit);
        LambdaQueryWrapper<Invite> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(Invite::getInviterId, inviterId)
                .orderByDesc(Invite::getCreatedAt)
                .orderByDesc(Invite::getId);
        return inviteMapper.selectPage(page, wrapper);
    }

    @Override
    public Optional<InviteDto.CompanyTarget> companyTarget(Invite invite) {
        if (invite == null || invite.getInviteType() != InviteType.COMPANY || invite.getMetadata() == null) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(invite.getMetadata());
            JsonNode companyId = node.get("companyId");
            if (companyId == null || !companyId.canConvertToLong()) {
                return Optional.empty();
            }
            JsonNode teamId = node.get("teamId");
            return Optional.of(new InviteDto.CompanyTarget(
                    companyId.asLong(),
                    teamId == null || teamId.isNull() ? null : teamId.asLong()));
        } catch (JsonProcessingException ex) {
            throw new InternalException(ex, "邀请元数据损坏: inviteId=%s", invite.getId());
        }
    }

    private void insertWithFreshCode(Invite invite) {
        for (int attempt = 1; attempt <= MAX_CODE_ATTEMPTS; attempt++) {
            invite.setCode(generateCode());
            InsertResult result = transactionExecutor.insertOrConflict(() -> inviteMapper.insert(invite));
            if (result.wasInserted()) {
                return;
            }
            log.warn("security_event event=invite_code_collision attempt={}", attempt);
        }
        throw new InternalException("邀请码生成失败，请重试");
    }

    private String generateCode() {
        StringBuilder builder = new StringBuilder(InvitePolicy.CODE_LENGTH);
        byte[] buffer = new byte[1];
        while (builder.length() < InvitePolicy.CODE_LENGTH) {
            secureRandom.nextBytes(buffer);
            int sample = buffer[0] & 0xFF;
            if (sample < SAMPLE_BOUND) {
                builder.append(CODE_ALPHABET.charAt(sample % CODE_ALPHABET.length()));
            }
        }
        return builder.toString();
    }

    private String writeCompanyTarget(Long companyId, Long teamId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("companyId", companyId);
        metadata.put("teamId", teamId);
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            throw new InternalException(ex, "邀请元数据序列化失败");
        }
    }

    private InviteDto.Validation rejected(InviteRejection rejection) {
        InviteDto.Validation validation = new InviteDto.Validation();
        validation.setValid(false);
        validation.setReason(rejection.getCode());
        return validation;
    }

    private long resolveCurrent(int limit, int offset) {
        if (limit <= 0) {
            return 1;
        }
        return offset / limit + 1;
    }

    private static InviteType parseType(String code) {
        try {
            return InviteType.fromCode(code);
        } catch (IllegalArgumentException ex) {
            throw new InvalidInputException("邀请类型不合法: %s", code);
        }
    }
}
