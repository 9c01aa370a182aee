package com.sunny.procurehub.platform.module.ledger.model;

import lombok.Data;

/**
 * 账户分录汇总
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
public class LedgerTotals {

    private Long ledgerCredits;
    private Long ledgerDebits;

    public long credits() {
        return ledgerCredits == null ? 0L : ledgerCredits;
    }

    public long debits() {
        return ledgerDebits == null ? 0L : ledgerDebits;
    }
}
