package com.sunny.procurehub.platform.exception.community;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.BadRequestException;
import java.util.Map;

/**
 * 投票被拒绝异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class VoteRejectedException extends BadRequestException {

    public VoteRejectedException(String message) {
        super(ErrorType.VOTE_REJECTED, Map.of(), message);
    }
}
