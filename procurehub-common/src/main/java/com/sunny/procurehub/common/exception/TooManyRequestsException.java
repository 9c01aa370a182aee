package com.sunny.procurehub.common.exception;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;
import java.util.Map;

/**
 * 请求过于频繁异常
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class TooManyRequestsException extends ProcurehubRuntimeException {

    public TooManyRequestsException(String message, Object... args) {
        super(Code.TOO_MANY_REQUESTS, ErrorType.TOO_MANY_REQUESTS, null, false, message, args);
    }

    public TooManyRequestsException(Throwable cause, String message, Object... args) {
        super(cause, Code.TOO_MANY_REQUESTS, ErrorType.TOO_MANY_REQUESTS, null, false, message, args);
    }

    public TooManyRequestsException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.TOO_MANY_REQUESTS, type, context, false, message, args);
    }

    public TooManyRequestsException(Throwable cause,
                                    String type,
                                    Map<String, String> context,
                                    String message,
                                    Object... args) {
        super(cause, Code.TOO_MANY_REQUESTS, type, context, false, message, args);
    }
}
