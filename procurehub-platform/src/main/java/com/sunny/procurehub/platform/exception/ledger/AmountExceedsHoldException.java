package com.sunny.procurehub.platform.exception.ledger;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ProcurehubRuntimeException;
import java.util.Map;

/**
 * 实际扣减超出冻结额度异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class AmountExceedsHoldException extends ProcurehubRuntimeException {

    public AmountExceedsHoldException(long holdAmount, long actualAmount) {
        super(Code.UNPROCESSABLE,
                ErrorType.AMOUNT_EXCEEDS_HOLD,
                Map.of("holdAmount", String.valueOf(holdAmount), "actualAmount", String.valueOf(actualAmount)),
                false,
                "实际扣减超出冻结额度: hold=%d, actual=%d",
                holdAmount,
                actualAmount);
    }
}
