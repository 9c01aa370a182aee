package com.sunny.procurehub.platform.exception.auth;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ForbiddenException;
import java.util.Map;

/**
 * CSRF 校验失败异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class CsrfInvalidException extends ForbiddenException {

    public CsrfInvalidException() {
        super(ErrorType.CSRF_INVALID, Map.of(), "CSRF 校验失败");
    }

    public CsrfInvalidException(Throwable cause) {
        super(cause, ErrorType.CSRF_INVALID, Map.of(), "CSRF 校验失败");
    }
}
