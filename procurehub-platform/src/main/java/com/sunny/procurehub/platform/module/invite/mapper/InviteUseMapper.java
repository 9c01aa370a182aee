package com.sunny.procurehub.platform.module.invite.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.invite.entity.InviteUse;
import org.apache.ibatis.annotations.Mapper;

/**
 * 邀请使用记录 Mapper
 */
@Mapper
public interface InviteUseMapper extends BaseMapper<InviteUse> {
}
