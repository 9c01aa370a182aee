package com.sunny.procurehub.platform.module.organization.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.organization.entity.CompanyMember;
import org.apache.ibatis.annotations.Mapper;

/**
 * 公司成员 Mapper
 */
@Mapper
public interface CompanyMemberMapper extends BaseMapper<CompanyMember> {
}
