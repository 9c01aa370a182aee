package com.sunny.procurehub.platform.exception.ledger;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.AlreadyExistsException;
import java.util.Map;

/**
 * 积分账户已存在异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
public class CreditAccountExistsException extends AlreadyExistsException {

    public CreditAccountExistsException() {
        super(ErrorType.CREDIT_ACCOUNT_EXISTS, Map.of(), "该公司已存在积分账户");
    }

    public CreditAccountExistsException(Throwable cause) {
        super(cause, ErrorType.CREDIT_ACCOUNT_EXISTS, Map.of(), "该公司已存在积分账户");
    }
}
