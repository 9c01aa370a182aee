package com.sunny.procurehub.platform.module.approval.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalEvent;
import org.apache.ibatis.annotations.Mapper;

/**
 * 审批事件 Mapper
 */
@Mapper
public interface ApprovalEventMapper extends BaseMapper<ApprovalEvent> {
}
