package com.sunny.procurehub.platform.exception.ledger;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ConflictException;
import java.util.Map;

/**
 * 冻结非活跃异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class HoldNotActiveException extends ConflictException {

    public HoldNotActiveException() {
        super(ErrorType.HOLD_NOT_ACTIVE, Map.of(), "冻结已结束，无法转换");
    }

    public HoldNotActiveException(Throwable cause) {
        super(cause, ErrorType.HOLD_NOT_ACTIVE, Map.of(), "冻结已结束，无法转换");
    }
}
