package com.sunny.procurehub.platform.module.invite.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.invite.entity.Invite;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

/**
 * 邀请 Mapper
 */
@Mapper
public interface InviteMapper extends BaseMapper<Invite> {

    @Select("SELECT * FROM invites WHERE id = #{id} FOR UPDATE")
    Invite selectByIdForUpdate(@Param("id") Long id);

    /**
     * 条件自增，已用满时返回 0
     */
    @Update("UPDATE invites SET use_count = use_count + 1 WHERE id = #{id} AND use_count < max_uses")
    int incrementUseCount(@Param("id") Long id);
}
