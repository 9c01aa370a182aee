package com.sunny.procurehub.platform.module.user.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 用户资料
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("profiles")
public class Profile {

    @TableId(value = "user_id", type = IdType.INPUT)
    private Long userId;

    @TableField("display_name")
    private String displayName;

    @TableField("reputation")
    private Integer reputation;

    @TableField("invite_slots")
    private Integer inviteSlots;

    @TableField("current_streak")
    private Integer currentStreak;

    @TableField("longest_streak")
    private Integer longestStreak;

    @TableField("last_active_date")
    private LocalDate lastActiveDate;

    @TableField("onboarding_step")
    private String onboardingStep;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
