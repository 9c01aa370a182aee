package com.sunny.procurehub.platform.module.organization.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 组织角色枚举
 * rank 越大权限越高
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum OrgRole {

    MEMBER("member", 1),
    APPROVER("approver", 2),
    ADMIN("admin", 3),
    OWNER("owner", 4);

    @EnumValue
    @JsonValue
    private final String code;

    private final int rank;

    OrgRole(String code, int rank) {
        this.code = code;
        this.rank = rank;
    }

    public boolean isAdminOrOwner() {
        return this == ADMIN || this == OWNER;
    }

    public boolean canApprove() {
        return rank >= APPROVER.rank;
    }

    public static OrgRole fromCode(String code) {
        for (OrgRole role : values()) {
            if (role.code.equalsIgnoreCase(code)) {
                return role;
            }
        }
        throw new IllegalArgumentException("未知组织角色: " + code);
    }
}
