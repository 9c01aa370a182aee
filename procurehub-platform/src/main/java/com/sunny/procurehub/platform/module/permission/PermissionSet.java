package com.sunny.procurehub.platform.module.permission;

/**
 * 能力集合
 *
 * @author Sunny
 * @date 2026-03-02
 */
public record PermissionSet(
        boolean canAccessChat,
        boolean canReadCommunity,
        boolean canAsk,
        boolean canAnswer,
        boolean canComment,
        boolean canUpvote,
        boolean canDownvote,
        boolean canInvite,
        boolean canModerate,
        int inviteSlots) {

    public static final PermissionSet ANONYMOUS =
            new PermissionSet(true, true, false, false, false, false, false, false, false, 0);
}
