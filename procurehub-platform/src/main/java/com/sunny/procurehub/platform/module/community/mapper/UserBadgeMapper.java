package com.sunny.procurehub.platform.module.community.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.community.entity.UserBadge;
import com.sunny.procurehub.platform.module.community.model.AwardedBadge;
import java.util.List;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * 用户徽章 Mapper
 */
@Mapper
public interface UserBadgeMapper extends BaseMapper<UserBadge> {

    @Select("SELECT b.id AS badge_id, b.slug, b.name, b.description, b.tier, ub.awarded_at "
            + "FROM user_badges ub JOIN badges b ON b.id = ub.badge_id "
            + "WHERE ub.user_id = #{userId} ORDER BY ub.awarded_at, b.id")
    List<AwardedBadge> selectAwardedByUser(@Param("userId") Long userId);
}
