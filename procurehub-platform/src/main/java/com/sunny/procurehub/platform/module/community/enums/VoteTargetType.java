package com.sunny.procurehub.platform.module.community.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 投票目标类型
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum VoteTargetType {

    QUESTION("question"),
    ANSWER("answer");

    @EnumValue
    @JsonValue
    private final String code;

    VoteTargetType(String code) {
        this.code = code;
    }

    @JsonCreator
    public static VoteTargetType fromCode(String code) {
        for (VoteTargetType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知投票目标: " + code);
    }
}
