package com.sunny.procurehub.platform.module.invite.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.procurehub.platform.module.invite.enums.InviteType;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 邀请
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("invites")
public class Invite {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("code")
    private String code;

    @TableField("invite_type")
    private InviteType inviteType;

    /**
     * 定向邀请限定邮箱，小写保存
     */
    @TableField("email")
    private String email;

    @TableField("inviter_id")
    private Long inviterId;

    @TableField("max_uses")
    private Integer maxUses;

    @TableField("use_count")
    private Integer useCount;

    @TableField("expires_at")
    private LocalDateTime expiresAt;

    /**
     * JSON，公司邀请记录 companyId 与 teamId
     */
    @TableField("metadata")
    private String metadata;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
