package com.sunny.procurehub.platform.module.approval.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 审批事件类型
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum ApprovalEventType {

    CREATED("created"),
    SUBMITTED("submitted"),
    AUTO_APPROVED("auto_approved"),
    ASSIGNED("assigned"),
    APPROVED("approved"),
    DENIED("denied"),
    ESCALATED("escalated"),
    CANCELLED("cancelled"),
    EXPIRED("expired"),
    FULFILLED("fulfilled");

    @EnumValue
    @JsonValue
    private final String code;

    ApprovalEventType(String code) {
        this.code = code;
    }
}
