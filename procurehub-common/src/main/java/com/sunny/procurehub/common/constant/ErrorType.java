package com.sunny.procurehub.common.constant;

/**
 * 统一错误类型常量
 * 业务语义统一通过 type 字段传递
 *
 * @author Sunny
 * @date 2026-02-23
 */
public final class ErrorType {

    public static final String BAD_REQUEST = "BAD_REQUEST";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String FORBIDDEN = "FORBIDDEN";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String ALREADY_EXISTS = "ALREADY_EXISTS";
    public static final String CONFLICT = "CONFLICT";
    public static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
    public static final String TOO_MANY_REQUESTS = "TOO_MANY_REQUESTS";
    public static final String SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    // 输入
    public static final String INVALID_INPUT = "INVALID_INPUT";

    // 认证
    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String UNAUTHENTICATED = "UNAUTHENTICATED";
    public static final String CSRF_INVALID = "CSRF_INVALID";
    public static final String RATE_LIMITED = "RATE_LIMITED";

    // 邀请与注册
    public static final String INVITE_INVALID = "INVITE_INVALID";
    public static final String INVITE_RACE_LOST = "INVITE_RACE_LOST";
    public static final String INVITE_SLOTS_EXHAUSTED = "INVITE_SLOTS_EXHAUSTED";
    public static final String EMAIL_TAKEN = "EMAIL_TAKEN";
    public static final String VERIFICATION_TOKEN_INVALID = "VERIFICATION_TOKEN_INVALID";

    // 额度账本
    public static final String INSUFFICIENT_FUNDS = "INSUFFICIENT_FUNDS";
    public static final String AMOUNT_EXCEEDS_HOLD = "AMOUNT_EXCEEDS_HOLD";
    public static final String HOLD_NOT_ACTIVE = "HOLD_NOT_ACTIVE";
    public static final String CREDIT_ACCOUNT_EXISTS = "CREDIT_ACCOUNT_EXISTS";
    public static final String LEDGER_INVARIANT_VIOLATED = "LEDGER_INVARIANT_VIOLATED";

    // 审批
    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";
    public static final String APPROVAL_FORBIDDEN = "APPROVAL_FORBIDDEN";

    // 社区
    public static final String VOTE_REJECTED = "VOTE_REJECTED";

    // 存储
    public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
    public static final String STORE_TIMEOUT = "STORE_TIMEOUT";
    public static final String STORE_CONSTRAINT_VIOLATION = "STORE_CONSTRAINT_VIOLATION";
    public static final String STORE_INTERNAL = "STORE_INTERNAL";

    private ErrorType() {
    }
}
