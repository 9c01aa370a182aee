package com.sunny.procurehub.common.exception;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;
import java.util.Map;

/**
 * 资源已存在异常
 *
 * @author Sunny
 * @date 2026-01-01
 */
public class AlreadyExistsException extends ProcurehubRuntimeException {

    public AlreadyExistsException(String message, Object... args) {
        super(Code.CONFLICT, ErrorType.ALREADY_EXISTS, null, false, message, args);
    }

    public AlreadyExistsException(Throwable cause, String message, Object... args) {
        super(cause, Code.CONFLICT, ErrorType.ALREADY_EXISTS, null, false, message, args);
    }

    public AlreadyExistsException(String type, Map<String, String> context, String message, Object... args) {
        super(Code.CONFLICT, type, context, false, message, args);
    }

    public AlreadyExistsException(Throwable cause,
                                  String type,
                                  Map<String, String> context,
                                  String message,
                                  Object... args) {
        super(cause, Code.CONFLICT, type, context, false, message, args);
    }
}
