package com.sunny.procurehub.platform.module.ledger.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.ledger.entity.CreditAccount;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * 积分账户 Mapper
 */
@Mapper
public interface CreditAccountMapper extends BaseMapper<CreditAccount> {

    /**
     * 同一账户的所有余额变动都在这把行锁后串行
     */
    @Select("SELECT * FROM credit_accounts WHERE id = #{id} FOR UPDATE")
    CreditAccount selectByIdForUpdate(@Param("id") Long id);
}
