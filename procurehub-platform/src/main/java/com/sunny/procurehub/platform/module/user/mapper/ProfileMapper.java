package com.sunny.procurehub.platform.module.user.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.user.entity.Profile;
import java.time.LocalDateTime;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

/**
 * 用户资料 Mapper
 */
@Mapper
public interface ProfileMapper extends BaseMapper<Profile> {

    /**
     * 名额为 0 时不更新，返回 0
     */
    @Update("UPDATE profiles SET invite_slots = invite_slots - 1, updated_at = #{now} "
            + "WHERE user_id = #{userId} AND invite_slots > 0")
    int decrementInviteSlot(@Param("userId") Long userId, @Param("now") LocalDateTime now);

    /**
     * 声望下限为 0
     */
    @Update("UPDATE profiles SET reputation = GREATEST(reputation + #{delta}, 0), updated_at = #{now} "
            + "WHERE user_id = #{userId}")
    int applyReputationDelta(@Param("userId") Long userId,
                             @Param("delta") int delta,
                             @Param("now") LocalDateTime now);
}
