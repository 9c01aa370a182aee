package com.sunny.procurehub.platform.module.community.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.procurehub.platform.module.community.entity.Question;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

/**
 * 问题 Mapper
 */
@Mapper
public interface QuestionMapper extends BaseMapper<Question> {

    @Select("SELECT * FROM questions WHERE id = #{id} FOR UPDATE")
    Question selectByIdForUpdate(@Param("id") Long id);

    @Update("UPDATE questions SET score = score + #{delta} WHERE id = #{id}")
    int adjustScore(@Param("id") Long id, @Param("delta") int delta);

    @Select("SELECT COALESCE(MAX(score), 0) FROM questions WHERE author_id = #{authorId}")
    long selectMaxScoreByAuthor(@Param("authorId") Long authorId);
}
