package com.sunny.procurehub.common.exception;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;
import java.util.Map;

/**
 * 服务内部异常
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class InternalException extends ProcurehubRuntimeException {

    public InternalException(String message, Object... args) {
        super(Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, null, false, message, args);
    }

    public InternalException(Throwable cause, String message, Object... args) {
        super(cause, Code.INTERNAL_ERROR, ErrorType.INTERNAL_ERROR, null, false, message, args);
    }

    public InternalException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.INTERNAL_ERROR, type, context, false, message, args);
    }

    public InternalException(Throwable cause,
                             String type,
                             Map<String, String> context,
                             String message,
                             Object... args) {
        super(cause, Code.INTERNAL_ERROR, type, context, false, message, args);
    }
}
