package com.sunny.procurehub.platform.exception.auth;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.UnauthorizedException;
import java.util.Map;

/**
 * 凭证错误异常
 * 登录路径统一返回，不区分邮箱不存在或密码错误
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class InvalidCredentialsException extends UnauthorizedException {

    public InvalidCredentialsException() {
        super(ErrorType.INVALID_CREDENTIALS, Map.of(), "邮箱或密码错误");
    }

    public InvalidCredentialsException(Throwable cause) {
        super(cause, ErrorType.INVALID_CREDENTIALS, Map.of(), "邮箱或密码错误");
    }
}
