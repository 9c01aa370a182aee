package com.sunny.procurehub.platform.module.community.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.community.entity.Vote;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * 投票 Mapper
 */
@Mapper
public interface VoteMapper extends BaseMapper<Vote> {

    /**
     * 用户的问题与回答累计收到的赞同票
     */
    @Select("SELECT COUNT(*) FROM votes v "
            + "LEFT JOIN questions q ON v.target_type = 'question' AND v.target_id = q.id "
            + "LEFT JOIN answers a ON v.target_type = 'answer' AND v.target_id = a.id "
            + "WHERE v.vote_value = 1 AND (q.author_id = #{userId} OR a.author_id = #{userId})")
    long countUpvotesReceived(@Param("userId") Long userId);
}
