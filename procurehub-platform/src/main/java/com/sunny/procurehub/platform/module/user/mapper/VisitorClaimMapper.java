package com.sunny.procurehub.platform.module.user.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.user.entity.VisitorClaim;
import org.apache.ibatis.annotations.Mapper;

/**
 * 访客认领 Mapper
 */
@Mapper
public interface VisitorClaimMapper extends BaseMapper<VisitorClaim> {
}
