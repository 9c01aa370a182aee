package com.sunny.procurehub.platform.module.ledger.service;

import com.baomidou.mybatisplus.core.metadata.IPage;
import com.sunny.procurehub.platform.module.ledger.dto.LedgerDto;
import com.sunny.procurehub.platform.module.ledger.entity.CreditAccount;
import com.sunny.procurehub.platform.module.ledger.entity.CreditHold;
import com.sunny.procurehub.platform.module.ledger.entity.LedgerEntry;
import java.util.List;
import java.util.Optional;

/**
 * 积分账本服务
 * 每个写操作都是一个事务，可用余额 = 基线 + 贷记 - 借记 - 活跃冻结
 */
public interface CreditLedgerService {

    CreditAccount openAccount(LedgerDto.OpenAccount dto);

    /**
     * 只改账户头，不产生分录
     */
    CreditAccount adjustBaseline(Long accountId, long totalCredits, long bonusCredits, Long actorId);

    LedgerDto.HoldResult placeHold(Long accountId, Long requestId, long amount, String idempotencyKey, Long actorId);

    LedgerDto.ReleaseResult releaseHold(Long holdId, Long actorId);

    LedgerDto.EntryResult convertHold(Long holdId, long actualAmount, String referenceType, String referenceId,
                                      String idempotencyKey, Long actorId);

    LedgerDto.EntryResult directDebit(LedgerDto.PostEntry entry);

    LedgerDto.EntryResult credit(LedgerDto.PostEntry entry);

    LedgerDto.Balance balance(Long accountId);

    Optional<CreditAccount> findAccountByCompany(Long companyId);

    Optional<CreditHold> findHoldByRequest(Long requestId);

    CreditHold getHold(Long holdId);

    IPage<LedgerEntry> listTransactions(Long accountId, int limit, int offset);

    List<CreditHold> listActiveHolds(Long accountId);
}
