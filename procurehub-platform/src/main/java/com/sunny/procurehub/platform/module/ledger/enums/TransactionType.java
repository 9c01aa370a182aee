package com.sunny.procurehub.platform.module.ledger.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 账本交易类型
 * 订阅基线额度只记录在账户头上，不存在对应的交易类型
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum TransactionType {

    SPEND("spend", LedgerDirection.DEBIT, true),
    ADJUSTMENT("adjustment", LedgerDirection.DEBIT, true),
    EXPIRY("expiry", LedgerDirection.DEBIT, true),
    HOLD_CONVERSION("hold_conversion", LedgerDirection.DEBIT, false),
    REFUND("refund", LedgerDirection.CREDIT, true),
    ROLLOVER("rollover", LedgerDirection.CREDIT, true);

    @EnumValue
    @JsonValue
    private final String code;

    private final LedgerDirection direction;

    /**
     * 是否允许调用方直接记账；冻结转换只能经由 convertHold 产生
     */
    private final boolean directlyPostable;

    TransactionType(String code, LedgerDirection direction, boolean directlyPostable) {
        this.code = code;
        this.direction = direction;
        this.directlyPostable = directlyPostable;
    }

    @JsonCreator
    public static TransactionType fromCode(String code) {
        for (TransactionType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知交易类型: " + code);
    }
}
