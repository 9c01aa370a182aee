package com.sunny.procurehub.platform.module.ledger.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 账本分录方向
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum LedgerDirection {

    DEBIT("debit"),
    CREDIT("credit");

    @EnumValue
    @JsonValue
    private final String code;

    LedgerDirection(String code) {
        this.code = code;
    }
}
