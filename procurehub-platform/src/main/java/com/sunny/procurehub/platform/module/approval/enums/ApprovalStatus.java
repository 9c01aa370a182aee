package com.sunny.procurehub.platform.module.approval.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;

/**
 * 审批请求状态
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum ApprovalStatus {

    DRAFT("draft"),
    PENDING("pending"),
    APPROVED("approved"),
    DENIED("denied"),
    CANCELLED("cancelled"),
    FULFILLED("fulfilled"),
    EXPIRED("expired");

    @EnumValue
    @JsonValue
    private final String code;

    ApprovalStatus(String code) {
        this.code = code;
    }

    public boolean isTerminal() {
        return this == DENIED || this == CANCELLED || this == FULFILLED || this == EXPIRED;
    }

    public boolean canTransitionTo(ApprovalStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<ApprovalStatus> allowedTargets() {
        return switch (this) {
            case DRAFT -> EnumSet.of(PENDING, CANCELLED);
            case PENDING -> EnumSet.of(APPROVED, DENIED, CANCELLED, EXPIRED);
            case APPROVED -> EnumSet.of(FULFILLED);
            default -> EnumSet.noneOf(ApprovalStatus.class);
        };
    }
}
