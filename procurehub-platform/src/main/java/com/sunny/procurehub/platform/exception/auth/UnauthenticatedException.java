package com.sunny.procurehub.platform.exception.auth;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.UnauthorizedException;
import java.util.Map;

/**
 * 未认证异常
 * 会话缺失或已过期
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class UnauthenticatedException extends UnauthorizedException {

    public UnauthenticatedException() {
        super(ErrorType.UNAUTHENTICATED, Map.of(), "未登录或会话已过期");
    }

    public UnauthenticatedException(Throwable cause) {
        super(cause, ErrorType.UNAUTHENTICATED, Map.of(), "未登录或会话已过期");
    }
}
