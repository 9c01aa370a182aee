package com.sunny.procurehub.platform.module.approval.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalRule;
import org.apache.ibatis.annotations.Mapper;

/**
 * 审批规则 Mapper
 */
@Mapper
public interface ApprovalRuleMapper extends BaseMapper<ApprovalRule> {
}
