package com.sunny.procurehub.platform.module.invite.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 邀请使用记录
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("invite_uses")
public class InviteUse {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("invite_id")
    private Long inviteId;

    @TableField("user_id")
    private Long userId;

    @TableField("used_at")
    private LocalDateTime usedAt;
}
