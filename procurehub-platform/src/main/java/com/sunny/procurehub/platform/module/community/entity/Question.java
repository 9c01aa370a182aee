package com.sunny.procurehub.platform.module.community.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 社区问题
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("questions")
public class Question {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("author_id")
    private Long authorId;

    @TableField("title")
    private String title;

    @TableField("body")
    private String body;

    @TableField("score")
    private Integer score;

    @TableField("accepted_answer_id")
    private Long acceptedAnswerId;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
