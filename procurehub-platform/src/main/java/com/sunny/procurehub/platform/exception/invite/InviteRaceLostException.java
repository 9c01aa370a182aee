package com.sunny.procurehub.platform.exception.invite;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.BadRequestException;
import java.util.Map;

/**
 * 邀请码争用失败异常
 * 并发注册中本次未抢到最后一个名额
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class InviteRaceLostException extends BadRequestException {

    public InviteRaceLostException() {
        super(ErrorType.INVITE_RACE_LOST, Map.of(), "邀请码已失效");
    }

    public InviteRaceLostException(Throwable cause) {
        super(cause, ErrorType.INVITE_RACE_LOST, Map.of(), "邀请码已失效");
    }
}
