package com.sunny.procurehub.platform.module.community.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 社区回答
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("answers")
public class Answer {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("question_id")
    private Long questionId;

    @TableField("author_id")
    private Long authorId;

    @TableField("body")
    private String body;

    @TableField("score")
    private Integer score;

    @TableField("is_accepted")
    private Boolean accepted;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
