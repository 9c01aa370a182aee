package com.sunny.procurehub.platform.module.permission;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 权限解析器
 * 由认证状态、声望、邀请名额与组织角色推导能力集合，不访问存储
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Component
@RequiredArgsConstructor
public class PermissionResolver {

    public static final int UPVOTE_REPUTATION = 50;
    public static final int COMMENT_REPUTATION = 100;
    public static final int DOWNVOTE_REPUTATION = 250;
    public static final int MODERATE_REPUTATION = 1000;

    private final PlatformSecurityProperties securityProperties;

    public PermissionSet resolve(AuthStatus status, int reputation, int inviteSlots, OrgRole role) {
        PermissionSet base = resolveByStatus(status, reputation, inviteSlots);
        if (status == AuthStatus.ANONYMOUS || role == null || !role.isAdminOrOwner()) {
            return base;
        }
        int slots = Math.max(inviteSlots, securityProperties.getInvite().getAdminQuota());
        return new PermissionSet(
                base.canAccessChat(),
                base.canReadCommunity(),
                base.canAsk(),
                base.canAnswer(),
                base.canComment(),
                base.canUpvote(),
                base.canDownvote(),
                true,
                true,
                slots);
    }

    private PermissionSet resolveByStatus(AuthStatus status, int reputation, int inviteSlots) {
        if (status != AuthStatus.VERIFIED) {
            return PermissionSet.ANONYMOUS;
        }
        int slots = Math.max(inviteSlots, 0);
        return new PermissionSet(
                true,
                true,
                true,
                true,
                reputation >= COMMENT_REPUTATION,
                reputation >= UPVOTE_REPUTATION,
                reputation >= DOWNVOTE_REPUTATION,
                slots > 0,
                reputation >= MODERATE_REPUTATION,
                slots);
    }
}
