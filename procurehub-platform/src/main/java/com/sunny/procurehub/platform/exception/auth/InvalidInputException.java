package com.sunny.procurehub.platform.exception.auth;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.BadRequestException;
import java.util.Map;

/**
 * 输入非法异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class InvalidInputException extends BadRequestException {

    public InvalidInputException(String message, Object... args) {
        super(ErrorType.INVALID_INPUT, Map.of(), message, args);
    }
}
