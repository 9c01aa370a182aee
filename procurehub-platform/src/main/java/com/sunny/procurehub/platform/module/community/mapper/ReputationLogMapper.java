package com.sunny.procurehub.platform.module.community.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.community.entity.ReputationLog;
import org.apache.ibatis.annotations.Mapper;

/**
 * 声望流水 Mapper
 */
@Mapper
public interface ReputationLogMapper extends BaseMapper<ReputationLog> {
}
