package com.sunny.procurehub.platform.module.community.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.procurehub.platform.module.community.enums.VoteTargetType;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 投票记录，(user_id, target_type, target_id) 唯一
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("votes")
public class Vote {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("user_id")
    private Long userId;

    @TableField("target_type")
    private VoteTargetType targetType;

    @TableField("target_id")
    private Long targetId;

    /**
     * 1 或 -1
     */
    @TableField("vote_value")
    private Integer voteValue;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
