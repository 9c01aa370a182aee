package com.sunny.procurehub.common.exception;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;
import java.util.Map;

/**
 * 未认证异常
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class UnauthorizedException extends ProcurehubRuntimeException {

    public UnauthorizedException(String message, Object... args) {
        super(Code.UNAUTHORIZED, ErrorType.UNAUTHORIZED, null, false, message, args);
    }

    public UnauthorizedException(Throwable cause, String message, Object... args) {
        super(cause, Code.UNAUTHORIZED, ErrorType.UNAUTHORIZED, null, false, message, args);
    }

    public UnauthorizedException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.UNAUTHORIZED, type, context, false, message, args);
    }

    public UnauthorizedException(Throwable cause,
                                 String type,
                                 Map<String, String> context,
                                 String message,
                                 Object... args) {
        super(cause, Code.UNAUTHORIZED, type, context, false, message, args);
    }
}
