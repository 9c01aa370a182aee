package com.sunny.procurehub.platform.module.ledger.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ConflictException;
import com.sunny.procurehub.common.exception.NotFoundException;
import com.sunny.procurehub.platform.exception.auth.InvalidInputException;
import com.sunny.procurehub.platform.exception.ledger.AmountExceedsHoldException;
import com.sunny.procurehub.platform.exception.ledger.HoldNotActiveException;
import com.sunny.procurehub.platform.exception.ledger.InsufficientFundsException;
import com.sunny.procurehub.platform.exception.ledger.LedgerInvariantViolationException;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.ledger.dto.LedgerDto;
import com.sunny.procurehub.platform.module.ledger.entity.CreditAccount;
import com.sunny.procurehub.platform.module.ledger.entity.CreditHold;
import com.sunny.procurehub.platform.module.ledger.entity.LedgerEntry;
import com.sunny.procurehub.platform.module.ledger.enums.HoldStatus;
import com.sunny.procurehub.platform.module.ledger.enums.LedgerDirection;
import com.sunny.procurehub.platform.module.ledger.enums.TransactionType;
import com.sunny.procurehub.platform.module.ledger.mapper.CreditAccountMapper;
import com.sunny.procurehub.platform.module.ledger.mapper.CreditHoldMapper;
import com.sunny.procurehub.platform.module.ledger.mapper.LedgerEntryMapper;
import com.sunny.procurehub.platform.module.ledger.model.LedgerTotals;
import com.sunny.procurehub.platform.module.ledger.service.CreditLedgerService;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 积分账本服务实现
 * 负责冻结、释放、转换、直接记账与余额计算
 *
 * <p>加锁顺序固定为 请求 → 冻结 → 账户。账户行锁串行化同一账户的全部余额变动，
 * 每次提交前复核可用余额非负，违反时整笔回滚。
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditLedgerServiceImpl implements CreditLedgerService {

    private final CreditAccountMapper creditAccountMapper;
    private final LedgerEntryMapper ledgerEntryMapper;
    private final CreditHoldMapper creditHoldMapper;
    private final TransactionExecutor transactionExecutor;
    private final Clock clock;

    @Override
    public CreditAccount openAccount(LedgerDto.OpenAccount dto) {
        if (dto == null || dto.getCompanyId() == null || !StringUtils.hasText(dto.getSubscriptionTier())) {
            throw new InvalidInputException("参数错误");
        }
        if (dto.getPeriodStart() == null || dto.getPeriodEnd() == null
                || !dto.getPeriodEnd().isAfter(dto.getPeriodStart())) {
            throw new InvalidInputException("订阅周期不合法");
        }
        long total = requireNonNegative(dto.getTotalCredits(), "基础额度不能为负");
        long bonus = requireNonNegative(dto.getBonusCredits(), "赠送额度不能为负");

        return transactionExecutor.execute(DbScene.CREDIT_ACCOUNT_OPEN, () -> {
            LocalDateTime now = LocalDateTime.now(clock);
            CreditAccount account = new CreditAccount();
            account.setCompanyId(dto.getCompanyId());
            account.setSubscriptionTier(dto.getSubscriptionTier().trim());
            account.setPeriodStart(dto.getPeriodStart());
            account.setPeriodEnd(dto.getPeriodEnd());
            account.setTotalCredits(total);
            account.setBonusCredits(bonus);
            account.setCreatedAt(now);
            account.setUpdatedAt(now);
            creditAccountMapper.insert(account);
            log.info("ledger_event event=account_opened accountId={} companyId={} tier={} total={} bonus={}",
                    account.getId(), account.getCompanyId(), account.getSubscriptionTier(), total, bonus);
            return account;
        });
    }

    @Override
    public CreditAccount adjustBaseline(Long accountId, long totalCredits, long bonusCredits, Long actorId) {
        if (totalCredits < 0 || bonusCredits < 0) {
            throw new InvalidInputException("额度不能为负");
        }
        return transactionExecutor.execute(DbScene.LEDGER, () -> {
            CreditAccount account = lockAccount(accountId);
            long available = computeAvailable(account);
            long baselineDelta = (totalCredits + bonusCredits) - (account.getTotalCredits() + account.getBonusCredits());
            if (available + baselineDelta < 0) {
                throw new InsufficientFundsException(available, -baselineDelta);
            }
            account.setTotalCredits(totalCredits);
            account.setBonusCredits(bonusCredits);
            account.setUpdatedAt(LocalDateTime.now(clock));
            creditAccountMapper.updateById(account);
            log.info("ledger_event event=baseline_adjusted accountId={} total={} bonus={} actorId={}",
                    accountId, totalCredits, bonusCredits, actorId);
            return account;
        });
    }

    @Override
    public LedgerDto.HoldResult placeHold(Long accountId, Long requestId, long amount, String idempotencyKey,
                                          Long actorId) {
        if (amount <= 0) {
            throw new InvalidInputException("冻结金额必须大于0");
        }
        if (requestId == null) {
            throw new InvalidInputException("请求不能为空");
        }
        String key = requireIdempotencyKey(idempotencyKey);

        return transactionExecutor.execute(DbScene.LEDGER, () -> {
            CreditAccount account = lockAccount(accountId);

            CreditHold existing = findHoldByRequest(requestId).orElse(null);
            if (existing != null) {
                if (!existing.getAccountId().equals(accountId) || !key.equals(existing.getIdempotencyKey())) {
                    throw new ConflictException(ErrorType.CONFLICT,
                            Map.of("requestId", String.valueOf(requestId)), "该请求已存在冻结");
                }
                return toHoldResult(existing, computeAvailable(account), false);
            }
            if (findHoldByKey(accountId, key) != null) {
                throw new ConflictException(ErrorType.CONFLICT, Map.of(), "幂等键已用于其他请求");
            }

            long available = computeAvailable(account);
            if (amount > available) {
                log.info("ledger_event event=hold_rejected accountId={} requestId={} amount={} available={}",
                        accountId, requestId, amount, available);
                throw new InsufficientFundsException(available, amount);
            }

            CreditHold hold = new CreditHold();
            hold.setAccountId(accountId);
            hold.setRequestId(requestId);
            hold.setAmount(amount);
            hold.setStatus(HoldStatus.ACTIVE);
            hold.setIdempotencyKey(key);
            hold.setActorId(actorId);
            hold.setCreatedAt(LocalDateTime.now(clock));
            creditHoldMapper.insert(hold);

            long after = ensureNonNegative(account);
            log.info("ledger_event event=hold_placed accountId={} holdId={} requestId={} amount={} available={}",
                    accountId, hold.getId(), requestId, amount, after);
            return toHoldResult(hold, after, true);
        });
    }

    @Override
    public LedgerDto.ReleaseResult releaseHold(Long holdId, Long actorId) {
        return transactionExecutor.execute(DbScene.LEDGER, () -> {
            CreditHold hold = lockHold(holdId);
            CreditAccount account = creditAccountMapper.selectById(hold.getAccountId());

            LedgerDto.ReleaseResult result = new LedgerDto.ReleaseResult();
            result.setHoldId(holdId);
            if (hold.getStatus().isTerminal()) {
                result.setStatus(hold.getStatus().getCode());
                result.setAlreadyTerminal(true);
                result.setAvailableCredits(computeAvailable(account));
                return result;
            }

            LambdaUpdateWrapper<CreditHold> update = new LambdaUpdateWrapper<>();
            update.eq(CreditHold::getId, holdId)
                    .eq(CreditHold::getStatus, HoldStatus.ACTIVE)
                    .set(CreditHold::getStatus, HoldStatus.RELEASED)
                    .set(CreditHold::getReleasedAt, LocalDateTime.now(clock));
            creditHoldMapper.update(null, update);

            long available = computeAvailable(account);
            log.info("ledger_event event=hold_released accountId={} holdId={} requestId={} amount={} actorId={} available={}",
                    hold.getAccountId(), holdId, hold.getRequestId(), hold.getAmount(), actorId, available);
            result.setStatus(HoldStatus.RELEASED.getCode());
            result.setAlreadyTerminal(false);
            result.setAvailableCredits(available);
            return result;
        });
    }

    @Override
    public LedgerDto.EntryResult convertHold(Long holdId, long actualAmount, String referenceType, String referenceId,
                                             String idempotencyKey, Long actorId) {
        String key = requireIdempotencyKey(idempotencyKey);

        return transactionExecutor.execute(DbScene.LEDGER, () -> {
            CreditHold hold = lockHold(holdId);

            LedgerEntry replay = findEntryByKey(hold.getAccountId(), key);
            if (replay != null) {
                if (hold.getStatus() == HoldStatus.CONVERTED && replay.getTransactionType() == TransactionType.HOLD_CONVERSION) {
                    CreditAccount account = creditAccountMapper.selectById(hold.getAccountId());
                    return toEntryResult(replay, computeAvailable(account), true);
                }
                throw new ConflictException(ErrorType.CONFLICT, Map.of(), "幂等键已被其他操作使用");
            }
            if (hold.getStatus() != HoldStatus.ACTIVE) {
                throw new HoldNotActiveException();
            }
            if (actualAmount <= 0) {
                throw new InvalidInputException("实际金额必须大于0");
            }
            if (actualAmount > hold.getAmount()) {
                throw new AmountExceedsHoldException(hold.getAmount(), actualAmount);
            }

            CreditAccount account = lockAccount(hold.getAccountId());
            LocalDateTime now = LocalDateTime.now(clock);
            LedgerEntry entry = new LedgerEntry();
            entry.setAccountId(hold.getAccountId());
            entry.setDirection(LedgerDirection.DEBIT);
            entry.setAmount(actualAmount);
            entry.setTransactionType(TransactionType.HOLD_CONVERSION);
            entry.setReferenceType(referenceType);
            entry.setReferenceId(referenceId);
            entry.setDescription("hold " + holdId + " converted");
            entry.setIdempotencyKey(key);
            entry.setActorId(actorId);
            entry.setCreatedAt(now);
            ledgerEntryMapper.insert(entry);

            LambdaUpdateWrapper<CreditHold> update = new LambdaUpdateWrapper<>();
            update.eq(CreditHold::getId, holdId)
                    .set(CreditHold::getStatus, HoldStatus.CONVERTED)
                    .set(CreditHold::getConvertedAt, now);
            creditHoldMapper.update(null, update);

            long available = ensureNonNegative(account);
            log.info("ledger_event event=hold_converted accountId={} holdId={} entryId={} holdAmount={} actual={} available={}",
                    hold.getAccountId(), holdId, entry.getId(), hold.getAmount(), actualAmount, available);
            return toEntryResult(entry, available, false);
        });
    }

    @Override
    public LedgerDto.EntryResult directDebit(LedgerDto.PostEntry post) {
        return post(post, LedgerDirection.DEBIT);
    }

    @Override
    public LedgerDto.EntryResult credit(LedgerDto.PostEntry post) {
        return post(post, LedgerDirection.CREDIT);
    }

    @Override
    public LedgerDto.Balance balance(Long accountId) {
        return transactionExecutor.execute(DbScene.LEDGER, () -> {
            CreditAccount account = creditAccountMapper.selectById(accountId);
            if (account == null) {
                throw new NotFoundException("积分账户不存在: %s", accountId);
            }
            LedgerTotals totals = sumEntries(accountId);
            long reserved = sumActiveHolds(accountId);

            LedgerDto.Balance balance = new LedgerDto.Balance();
            balance.setAccountId(account.getId());
            balance.setCompanyId(account.getCompanyId());
            balance.setTotalCredits(account.getTotalCredits());
            balance.setBonusCredits(account.getBonusCredits());
            balance.setLedgerCredits(totals.credits());
            balance.setLedgerDebits(totals.debits());
            balance.setReservedCredits(reserved);
            balance.setAvailableCredits(account.getTotalCredits() + account.getBonusCredits()
                    + totals.credits() - totals.debits() - reserved);
            balance.setSubscriptionTier(account.getSubscriptionTier());
            LocalDate end = account.getPeriodEnd().toLocalDate();
            balance.setSubscriptionEnd(end);
            balance.setDaysRemaining(Math.max(0L, ChronoUnit.DAYS.between(LocalDate.now(clock), end)));
            return balance;
        });
    }

    @Override
    public Optional<CreditAccount> findAccountByCompany(Long companyId) {
        if (companyId == null) {
            return Optional.empty();
        }
        LambdaQueryWrapper<CreditAccount> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(CreditAccount::getCompanyId, companyId);
        return Optional.ofNullable(creditAccountMapper.selectOne(wrapper));
    }

    @Override
    public Optional<CreditHold> findHoldByRequest(Long requestId) {
        LambdaQueryWrapper<CreditHold> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(CreditHold::getRequestId, requestId);
        return Optional.ofNullable(creditHoldMapper.selectOne(wrapper));
    }

    @Override
    public CreditHold getHold(Long holdId) {
        CreditHold hold = creditHoldMapper.selectById(holdId);
        if (hold == null) {
            throw new NotFoundException("冻结不存在: %s", holdId);
        }
        return hold;
    }

    @Override
    public IPage<LedgerEntry> listTransactions(Long accountId, int limit, int offset) {
        Page<LedgerEntry> page = Page.of(resolveCurrent(limit, offset), limit);
        LambdaQueryWrapper<LedgerEntry> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(LedgerEntry::getAccountId, accountId)
                .orderByDesc(LedgerEntry::getCreatedAt)
                .orderByDesc(LedgerEntry::getId);
        return ledgerEntryMapper.selectPage(page, wrapper);
    }

    @Override
    public List<CreditHold> listActiveHolds(Long accountId) {
        LambdaQueryWrapper<CreditHold> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(CreditHold::getAccountId, accountId)
                .eq(CreditHold::getStatus, HoldStatus.ACTIVE)
                .orderByDesc(CreditHold::getCreatedAt);
        return creditHoldMapper.selectList(wrapper);
    }

    private LedgerDto.EntryResult post(LedgerDto.PostEntry post, LedgerDirection direction) {
        if (post == null || post.getAccountId() == null || post.getAmount() == null || post.getAmount() <= 0) {
            throw new InvalidInputException("金额必须大于0");
        }
        TransactionType type = resolvePostableType(post.getTransactionType(), direction);
        String key = requireIdempotencyKey(post.getIdempotencyKey());
        long amount = post.getAmount();

        return transactionExecutor.execute(DbScene.LEDGER, () -> {
            CreditAccount account = lockAccount(post.getAccountId());

            LedgerEntry replay = findEntryByKey(account.getId(), key);
            if (replay != null) {
                if (replay.getDirection() != direction || replay.getAmount() != amount) {
                    throw new ConflictException(ErrorType.CONFLICT, Map.of(), "幂等键已被其他操作使用");
                }
                return toEntryResult(replay, computeAvailable(account), true);
            }

            if (direction == LedgerDirection.DEBIT) {
                long available = computeAvailable(account);
                if (amount > available) {
                    throw new InsufficientFundsException(available, amount);
                }
            }

            LedgerEntry entry = new LedgerEntry();
            entry.setAccountId(account.getId());
            entry.setDirection(direction);
            entry.setAmount(amount);
            entry.setTransactionType(type);
            entry.setReferenceType(post.getReferenceType());
            entry.setReferenceId(post.getReferenceId());
            entry.setDescription(post.getDescription());
            entry.setIdempotencyKey(key);
            entry.setActorId(post.getActorId());
            entry.setCreatedAt(LocalDateTime.now(clock));
            ledgerEntryMapper.insert(entry);

            long available = ensureNonNegative(account);
            log.info("ledger_event event=entry_posted accountId={} entryId={} direction={} type={} amount={} available={}",
                    account.getId(), entry.getId(), direction.getCode(), type.getCode(), amount, available);
            return toEntryResult(entry, available, false);
        });
    }

    private TransactionType resolvePostableType(String code, LedgerDirection direction) {
        TransactionType type;
        try {
            type = TransactionType.fromCode(code);
        } catch (IllegalArgumentException ex) {
            throw new InvalidInputException("交易类型不合法: %s", code);
        }
        if (!type.isDirectlyPostable() || type.getDirection() != direction) {
            throw new InvalidInputException("交易类型不合法: %s", code);
        }
        return type;
    }

    private CreditAccount lockAccount(Long accountId) {
        CreditAccount account = accountId == null ? null : creditAccountMapper.selectByIdForUpdate(accountId);
        if (account == null) {
            throw new NotFoundException("积分账户不存在: %s", accountId);
        }
        return account;
    }

    private CreditHold lockHold(Long holdId) {
        CreditHold hold = holdId == null ? null : creditHoldMapper.selectByIdForUpdate(holdId);
        if (hold == null) {
            throw new NotFoundException("冻结不存在: %s", holdId);
        }
        return hold;
    }

    private CreditHold findHoldByKey(Long accountId, String key) {
        LambdaQueryWrapper<CreditHold> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(CreditHold::getAccountId, accountId)
                .eq(CreditHold::getIdempotencyKey, key);
        return creditHoldMapper.selectOne(wrapper);
    }

    private LedgerEntry findEntryByKey(Long accountId, String key) {
        LambdaQueryWrapper<LedgerEntry> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(LedgerEntry::getAccountId, accountId)
                .eq(LedgerEntry::getIdempotencyKey, key);
        return ledgerEntryMapper.selectOne(wrapper);
    }

    private long computeAvailable(CreditAccount account) {
        LedgerTotals totals = sumEntries(account.getId());
        return account.getTotalCredits() + account.getBonusCredits()
                + totals.credits() - totals.debits() - sumActiveHolds(account.getId());
    }

    private long ensureNonNegative(CreditAccount account) {
        long available = computeAvailable(account);
        if (available < 0) {
            log.error("ledger_event event=invariant_violated accountId={} available={}", account.getId(), available);
            throw new LedgerInvariantViolationException(account.getId(), available);
        }
        return available;
    }

    private LedgerTotals sumEntries(Long accountId) {
        LedgerTotals totals = ledgerEntryMapper.sumByAccount(accountId);
        return totals == null ? new LedgerTotals() : totals;
    }

    private long sumActiveHolds(Long accountId) {
        Long reserved = creditHoldMapper.sumActiveByAccount(accountId);
        return reserved == null ? 0L : reserved;
    }

    private String requireIdempotencyKey(String idempotencyKey) {
        if (!StringUtils.hasText(idempotencyKey)) {
            throw new InvalidInputException("幂等键不能为空");
        }
        String key = idempotencyKey.trim();
        if (key.length() > 128) {
            throw new InvalidInputException("幂等键过长");
        }
        return key;
    }

    private long requireNonNegative(Long value, String message) {
        if (value == null) {
            return 0L;
        }
        if (value < 0) {
            throw new InvalidInputException(message);
        }
        return value;
    }

    private LedgerDto.HoldResult toHoldResult(CreditHold hold, long available, boolean created) {
        LedgerDto.HoldResult result = new LedgerDto.HoldResult();
        result.setHoldId(hold.getId());
        result.setAmount(hold.getAmount());
        result.setStatus(hold.getStatus().getCode());
        result.setAvailableCredits(available);
        result.setCreated(created);
        return result;
    }

    private LedgerDto.EntryResult toEntryResult(LedgerEntry entry, long available, boolean replayed) {
        LedgerDto.EntryResult result = new LedgerDto.EntryResult();
        result.setEntryId(entry.getId());
        result.setAmount(entry.getAmount());
        result.setAvailableCredits(available);
        result.setReplayed(replayed);
        return result;
    }

    private long resolveCurrent(int limit, int offset) {
        if (limit <= 0) {
            return 1;
        }
        return offset / limit + 1;
    }
}
