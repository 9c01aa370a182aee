package com.sunny.procurehub.platform.module.invite.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 邀请类型枚举
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum InviteType {

    DIRECT("direct", "定向邀请"),
    LINK("link", "链接邀请"),
    COMPANY("company", "公司邀请");

    @EnumValue
    @JsonValue
    private final String code;

    private final String description;

    InviteType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonCreator
    public static InviteType fromCode(String code) {
        for (InviteType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知邀请类型: " + code);
    }
}
