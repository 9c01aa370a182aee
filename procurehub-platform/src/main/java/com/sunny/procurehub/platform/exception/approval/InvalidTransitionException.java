package com.sunny.procurehub.platform.exception.approval;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ConflictException;
import java.util.Map;

/**
 * 审批状态流转非法异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class InvalidTransitionException extends ConflictException {

    public InvalidTransitionException(String currentStatus, String action) {
        super(ErrorType.INVALID_TRANSITION,
                Map.of("status", currentStatus, "action", action),
                "当前状态 %s 不允许执行 %s",
                currentStatus,
                action);
    }
}
