package com.sunny.procurehub.common.exception;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;
import java.util.Map;

/**
 * 无权限异常
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class ForbiddenException extends ProcurehubRuntimeException {

    public ForbiddenException(String message, Object... args) {
        super(Code.FORBIDDEN, ErrorType.FORBIDDEN, null, false, message, args);
    }

    public ForbiddenException(Throwable cause, String message, Object... args) {
        super(cause, Code.FORBIDDEN, ErrorType.FORBIDDEN, null, false, message, args);
    }

    public ForbiddenException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.FORBIDDEN, type, context, false, message, args);
    }

    public ForbiddenException(Throwable cause,
                              String type,
                              Map<String, String> context,
                              String message,
                              Object... args) {
        super(cause, Code.FORBIDDEN, type, context, false, message, args);
    }
}
