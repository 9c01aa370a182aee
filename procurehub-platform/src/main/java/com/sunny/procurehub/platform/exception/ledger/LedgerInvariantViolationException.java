package com.sunny.procurehub.platform.exception.ledger;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.InternalException;
import java.util.Map;

/**
 * 账本不变式破坏异常
 * 出现即回滚当前事务并以 ERROR 级别记录
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class LedgerInvariantViolationException extends InternalException {

    public LedgerInvariantViolationException(Long accountId, long available) {
        super(ErrorType.LEDGER_INVARIANT_VIOLATED,
                Map.of("accountId", String.valueOf(accountId), "available", String.valueOf(available)),
                "账本不变式被破坏: accountId=%s, available=%d",
                accountId,
                available);
    }
}
