package com.sunny.procurehub.platform.module.approval.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 审批请求类型
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum RequestType {

    REPORT_UPGRADE("report_upgrade"),
    ANALYST_QA("analyst_qa"),
    ANALYST_CALL("analyst_call"),
    EXPERT_CONSULT("expert_consult"),
    EXPERT_DEEPDIVE("expert_deepdive"),
    BESPOKE_PROJECT("bespoke_project");

    @EnumValue
    @JsonValue
    private final String code;

    RequestType(String code) {
        this.code = code;
    }

    @JsonCreator
    public static RequestType fromCode(String code) {
        for (RequestType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知请求类型: " + code);
    }
}
