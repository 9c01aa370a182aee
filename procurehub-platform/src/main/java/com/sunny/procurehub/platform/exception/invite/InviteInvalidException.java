package com.sunny.procurehub.platform.exception.invite;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.BadRequestException;
import com.sunny.procurehub.platform.module.invite.enums.InviteRejection;
import java.util.Map;

/**
 * 邀请码无效异常
 * context.reason 取值见 InviteRejection
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class InviteInvalidException extends BadRequestException {

    public InviteInvalidException(InviteRejection rejection) {
        super(ErrorType.INVITE_INVALID, Map.of("reason", rejection.getCode()), rejection.getMessage());
    }
}
