package com.sunny.procurehub.platform.exception.ledger;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ProcurehubRuntimeException;
import java.util.Map;

/**
 * 可用积分不足异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class InsufficientFundsException extends ProcurehubRuntimeException {

    private final long available;

    public InsufficientFundsException(long available, long requested) {
        super(Code.UNPROCESSABLE,
                ErrorType.INSUFFICIENT_FUNDS,
                Map.of("available", String.valueOf(available), "requested", String.valueOf(requested)),
                false,
                "可用积分不足: available=%d, requested=%d",
                available,
                requested);
        this.available = available;
    }

    public long getAvailable() {
        return available;
    }
}
