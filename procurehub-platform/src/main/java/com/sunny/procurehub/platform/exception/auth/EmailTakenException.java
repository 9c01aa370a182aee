package com.sunny.procurehub.platform.exception.auth;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ConflictException;
import java.util.Map;

/**
 * 邮箱已注册异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class EmailTakenException extends ConflictException {

    public EmailTakenException() {
        super(ErrorType.EMAIL_TAKEN, Map.of(), "邮箱已注册");
    }

    public EmailTakenException(Throwable cause) {
        super(cause, ErrorType.EMAIL_TAKEN, Map.of(), "邮箱已注册");
    }
}
