package com.sunny.procurehub.platform.module.ledger.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.ledger.entity.LedgerEntry;
import com.sunny.procurehub.platform.module.ledger.model.LedgerTotals;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * 账本分录 Mapper
 */
@Mapper
public interface LedgerEntryMapper extends BaseMapper<LedgerEntry> {

    @Select("SELECT COALESCE(SUM(CASE WHEN direction = 'credit' THEN amount ELSE 0 END), 0) AS ledger_credits, "
            + "COALESCE(SUM(CASE WHEN direction = 'debit' THEN amount ELSE 0 END), 0) AS ledger_debits "
            + "FROM ledger_entries WHERE account_id = #{accountId}")
    LedgerTotals sumByAccount(@Param("accountId") Long accountId);

    @Select("SELECT COALESCE(SUM(amount), 0) FROM ledger_entries "
            + "WHERE reference_type = #{referenceType} AND reference_id = #{referenceId} AND direction = 'debit'")
    Long sumDebitsByReference(@Param("referenceType") String referenceType, @Param("referenceId") String referenceId);
}
