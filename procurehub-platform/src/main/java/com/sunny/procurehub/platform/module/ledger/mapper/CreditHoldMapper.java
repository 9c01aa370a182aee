package com.sunny.procurehub.platform.module.ledger.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.ledger.entity.CreditHold;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * 积分冻结 Mapper
 */
@Mapper
public interface CreditHoldMapper extends BaseMapper<CreditHold> {

    @Select("SELECT * FROM credit_holds WHERE id = #{id} FOR UPDATE")
    CreditHold selectByIdForUpdate(@Param("id") Long id);

    @Select("SELECT COALESCE(SUM(amount), 0) FROM credit_holds WHERE account_id = #{accountId} AND status = 'active'")
    Long sumActiveByAccount(@Param("accountId") Long accountId);
}
