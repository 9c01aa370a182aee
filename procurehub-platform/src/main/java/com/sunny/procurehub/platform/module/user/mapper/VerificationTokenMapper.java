package com.sunny.procurehub.platform.module.user.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.user.entity.VerificationToken;
import org.apache.ibatis.annotations.Mapper;

/**
 * 邮箱验证令牌 Mapper
 */
@Mapper
public interface VerificationTokenMapper extends BaseMapper<VerificationToken> {
}
