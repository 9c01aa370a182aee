package com.sunny.procurehub.platform.module.community.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.community.entity.Badge;
import org.apache.ibatis.annotations.Mapper;

/**
 * 徽章目录 Mapper
 */
@Mapper
public interface BadgeMapper extends BaseMapper<Badge> {
}
