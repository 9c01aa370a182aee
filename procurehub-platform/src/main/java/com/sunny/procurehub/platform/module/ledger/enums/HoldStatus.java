package com.sunny.procurehub.platform.module.ledger.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 冻结状态
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum HoldStatus {

    ACTIVE("active"),
    CONVERTED("converted"),
    RELEASED("released");

    @EnumValue
    @JsonValue
    private final String code;

    HoldStatus(String code) {
        this.code = code;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
