package com.sunny.procurehub.common.exception;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;
import java.util.Map;

/**
 * 状态冲突异常
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class ConflictException extends ProcurehubRuntimeException {

    public ConflictException(String message, Object... args) {
        super(Code.CONFLICT, ErrorType.CONFLICT, null, false, message, args);
    }

    public ConflictException(Throwable cause, String message, Object... args) {
        super(cause, Code.CONFLICT, ErrorType.CONFLICT, null, false, message, args);
    }

    public ConflictException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.CONFLICT, type, context, false, message, args);
    }

    public ConflictException(Throwable cause,
                             String type,
                             Map<String, String> context,
                             String message,
                             Object... args) {
        super(cause, Code.CONFLICT, type, context, false, message, args);
    }
}
