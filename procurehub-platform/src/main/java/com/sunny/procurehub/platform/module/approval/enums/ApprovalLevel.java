package com.sunny.procurehub.platform.module.approval.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import java.util.List;
import lombok.Getter;

/**
 * 审批层级
 * eligibleRoles 按指派优先级排列
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum ApprovalLevel {

    AUTO("auto", 0, List.of()),
    APPROVER("approver", 1, List.of(OrgRole.APPROVER, OrgRole.ADMIN, OrgRole.OWNER)),
    ADMIN("admin", 2, List.of(OrgRole.ADMIN, OrgRole.OWNER));

    @EnumValue
    @JsonValue
    private final String code;

    private final int rank;

    private final List<OrgRole> eligibleRoles;

    ApprovalLevel(String code, int rank, List<OrgRole> eligibleRoles) {
        this.code = code;
        this.rank = rank;
        this.eligibleRoles = eligibleRoles;
    }

    public boolean isAbove(ApprovalLevel other) {
        return other == null || rank > other.rank;
    }

    /**
     * 手动升级的下一层级，已是最高层级时返回 null
     */
    public ApprovalLevel next() {
        return switch (this) {
            case AUTO -> APPROVER;
            case APPROVER -> ADMIN;
            case ADMIN -> null;
        };
    }

    @JsonCreator
    public static ApprovalLevel fromCode(String code) {
        for (ApprovalLevel level : values()) {
            if (level.code.equalsIgnoreCase(code)) {
                return level;
            }
        }
        throw new IllegalArgumentException("未知审批层级: " + code);
    }
}
