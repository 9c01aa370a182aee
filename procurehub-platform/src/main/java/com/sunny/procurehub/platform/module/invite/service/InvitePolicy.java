package com.sunny.procurehub.platform.module.invite.service;

import com.sunny.procurehub.platform.module.invite.entity.Invite;
import com.sunny.procurehub.platform.module.invite.enums.InviteRejection;
import com.sunny.procurehub.platform.module.invite.enums.InviteType;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 邀请可用性规则
 * 纯函数，不访问存储
 *
 * @author Sunny
 * @date 2026-03-02
 */
public final class InvitePolicy {

    public static final int CODE_LENGTH = 8;

    private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Z0-9]{8}$");

    private InvitePolicy() {
    }

    public static String normalizeCode(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean isValidCodeFormat(String code) {
        return code != null && CODE_PATTERN.matcher(code).matches();
    }

    /**
     * 依次检查过期、用满、邮箱限制；返回 empty 表示可用
     */
    public static Optional<InviteRejection> canUse(Invite invite, String forEmail, LocalDateTime now) {
        if (invite.getExpiresAt() != null && !invite.getExpiresAt().isAfter(now)) {
            return Optional.of(InviteRejection.EXPIRED);
        }
        if (isUsedUp(invite)) {
            return Optional.of(InviteRejection.USED_UP);
        }
        if (invite.getInviteType() == InviteType.DIRECT && invite.getEmail() != null && !invite.getEmail().isBlank()) {
            if (forEmail == null || forEmail.isBlank()) {
                return Optional.of(InviteRejection.EMAIL_REQUIRED);
            }
            if (!invite.getEmail().trim().equalsIgnoreCase(forEmail.trim())) {
                return Optional.of(InviteRejection.EMAIL_MISMATCH);
            }
        }
        return Optional.empty();
    }

    public static boolean isUsedUp(Invite invite) {
        int useCount = invite.getUseCount() == null ? 0 : invite.getUseCount();
        int maxUses = invite.getMaxUses() == null ? 1 : invite.getMaxUses();
        return useCount >= maxUses;
    }
}
