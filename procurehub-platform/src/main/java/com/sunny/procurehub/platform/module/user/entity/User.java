package com.sunny.procurehub.platform.module.user.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 用户
 * email 保存规范化（小写）形式，库级唯一索引基于 LOWER(email)
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("users")
public class User {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("email")
    private String email;

    @TableField("password_hash")
    private String passwordHash;

    @TableField("email_verified_at")
    private LocalDateTime emailVerifiedAt;

    @TableField("invited_by")
    private Long invitedBy;

    @TableField("invite_id")
    private Long inviteId;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;

    public boolean isEmailVerified() {
        return emailVerifiedAt != null;
    }
}
