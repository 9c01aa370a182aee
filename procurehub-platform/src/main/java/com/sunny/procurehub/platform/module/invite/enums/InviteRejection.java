package com.sunny.procurehub.platform.module.invite.enums;

import lombok.Getter;

/**
 * 邀请不可用原因
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum InviteRejection {

    INVALID_FORMAT("invalid_format", "邀请码无效"),
    NOT_FOUND("not_found", "邀请码无效"),
    EXPIRED("expired", "邀请码已过期"),
    USED_UP("used_up", "邀请码已被使用"),
    EMAIL_REQUIRED("email_required", "该邀请需要填写受邀邮箱"),
    EMAIL_MISMATCH("email_mismatch", "该邀请不属于当前邮箱");

    private final String code;
    private final String message;

    InviteRejection(String code, String message) {
        this.code = code;
        this.message = message;
    }
}
