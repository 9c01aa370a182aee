package com.sunny.procurehub.platform.module.community.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 声望流水，delta 记录的是请求的变化量
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("reputation_log")
public class ReputationLog {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("user_id")
    private Long userId;

    @TableField("delta")
    private Integer delta;

    @TableField("reason")
    private String reason;

    @TableField("reference_type")
    private String referenceType;

    @TableField("reference_id")
    private Long referenceId;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
