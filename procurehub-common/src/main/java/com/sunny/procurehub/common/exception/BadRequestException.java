package com.sunny.procurehub.common.exception;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;
import java.util.Map;

/**
 * 请求参数异常
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class BadRequestException extends ProcurehubRuntimeException {

    public BadRequestException(String message, Object... args) {
        super(Code.BAD_REQUEST, ErrorType.BAD_REQUEST, null, false, message, args);
    }

    public BadRequestException(Throwable cause, String message, Object... args) {
        super(cause, Code.BAD_REQUEST, ErrorType.BAD_REQUEST, null, false, message, args);
    }

    public BadRequestException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.BAD_REQUEST, type, context, false, message, args);
    }

    public BadRequestException(Throwable cause,
                               String type,
                               Map<String, String> context,
                               String message,
                               Object... args) {
        super(cause, Code.BAD_REQUEST, type, context, false, message, args);
    }
}
