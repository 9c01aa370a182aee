package com.sunny.procurehub.platform.exception.auth;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.BadRequestException;
import java.util.Map;

/**
 * 邮箱验证令牌无效异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class VerificationTokenInvalidException extends BadRequestException {

    public VerificationTokenInvalidException() {
        super(ErrorType.VERIFICATION_TOKEN_INVALID, Map.of(), "验证链接无效或已过期");
    }

    public VerificationTokenInvalidException(Throwable cause) {
        super(cause, ErrorType.VERIFICATION_TOKEN_INVALID, Map.of(), "验证链接无效或已过期");
    }
}
