package com.sunny.procurehub.platform.module.community.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 用户已获徽章
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("user_badges")
public class UserBadge {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("user_id")
    private Long userId;

    @TableField("badge_id")
    private Long badgeId;

    @TableField("awarded_at")
    private LocalDateTime awardedAt;
}
