package com.sunny.procurehub.platform.module.approval.enums;

import lombok.Getter;

/**
 * 审批动作
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum ApprovalAction {

    SUBMIT("submit"),
    APPROVE("approve"),
    DENY("deny"),
    CANCEL("cancel"),
    FULFILL("fulfill"),
    ESCALATE("escalate");

    private final String code;

    ApprovalAction(String code) {
        this.code = code;
    }

    public static ApprovalAction fromCode(String code) {
        for (ApprovalAction action : values()) {
            if (action.code.equalsIgnoreCase(code)) {
                return action;
            }
        }
        throw new IllegalArgumentException("未知审批动作: " + code);
    }
}
