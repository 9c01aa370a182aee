package com.sunny.procurehub.platform.exception.approval;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ForbiddenException;
import java.util.Map;

/**
 * 审批越权异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class ApprovalForbiddenException extends ForbiddenException {

    public ApprovalForbiddenException() {
        super(ErrorType.APPROVAL_FORBIDDEN, Map.of(), "无权处理该审批请求");
    }

    public ApprovalForbiddenException(Throwable cause) {
        super(cause, ErrorType.APPROVAL_FORBIDDEN, Map.of(), "无权处理该审批请求");
    }
}
