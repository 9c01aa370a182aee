package com.sunny.procurehub.platform.exception.translator;

/**
 * DB 异常场景
 *
 * @author Sunny
 * @date 2026-03-02
 */
public enum DbScene {

    GENERIC,
    USER_REGISTER,
    SESSION,
    VISITOR_CLAIM,
    INVITE_CREATE,
    INVITE_CONSUME,
    CREDIT_ACCOUNT_OPEN,
    LEDGER,
    APPROVAL,
    COMMUNITY
}
