package com.sunny.procurehub.platform.module.community.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.community.entity.Answer;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

/**
 * 回答 Mapper
 */
@Mapper
public interface AnswerMapper extends BaseMapper<Answer> {

    @Select("SELECT * FROM answers WHERE id = #{id} FOR UPDATE")
    Answer selectByIdForUpdate(@Param("id") Long id);

    @Update("UPDATE answers SET score = score + #{delta} WHERE id = #{id}")
    int adjustScore(@Param("id") Long id, @Param("delta") int delta);

    @Select("SELECT COALESCE(MAX(score), 0) FROM answers WHERE author_id = #{authorId}")
    long selectMaxScoreByAuthor(@Param("authorId") Long authorId);
}
