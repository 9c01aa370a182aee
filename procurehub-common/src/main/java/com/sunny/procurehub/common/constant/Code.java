package com.sunny.procurehub.common.constant;

/**
 * 响应状态码
 * 与 HTTP 状态一致，细分原因看 ErrorType
 *
 * @author Sunny
 * @date 2026-03-02
 */
public final class Code {

    /**
     * 参数不合法、邀请无效、邀请争用失败、非唯一约束冲突
     */
    public static final int BAD_REQUEST = 400;
    /**
     * 未登录、会话过期、凭证错误
     */
    public static final int UNAUTHORIZED = 401;
    /**
     * CSRF 校验失败、审批越权、邀请名额用尽
     */
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    /**
     * 邮箱已注册、非法状态迁移、冻结已结束、幂等键复用
     */
    public static final int CONFLICT = 409;
    /**
     * 可用额度不足、实际金额超出冻结
     */
    public static final int UNPROCESSABLE = 422;
    public static final int TOO_MANY_REQUESTS = 429;
    /**
     * 账本不变量被破坏、未归类的存储错误
     */
    public static final int INTERNAL_ERROR = 500;
    /**
     * 存储不可用或超时
     */
    public static final int SERVICE_UNAVAILABLE = 503;

    private Code() {
    }
}
