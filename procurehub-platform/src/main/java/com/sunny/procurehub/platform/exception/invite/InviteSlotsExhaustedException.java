package com.sunny.procurehub.platform.exception.invite;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ForbiddenException;
import java.util.Map;

/**
 * 邀请名额不足异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class InviteSlotsExhaustedException extends ForbiddenException {

    public InviteSlotsExhaustedException() {
        super(ErrorType.INVITE_SLOTS_EXHAUSTED, Map.of(), "邀请名额已用完");
    }

    public InviteSlotsExhaustedException(Throwable cause) {
        super(cause, ErrorType.INVITE_SLOTS_EXHAUSTED, Map.of(), "邀请名额已用完");
    }
}
