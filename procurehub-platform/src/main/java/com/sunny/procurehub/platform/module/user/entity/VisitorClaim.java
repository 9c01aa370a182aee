package com.sunny.procurehub.platform.module.user.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 访客认领记录
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("visitor_claims")
public class VisitorClaim {

    @TableId(value = "visitor_id", type = IdType.INPUT)
    private String visitorId;

    @TableField("user_id")
    private Long userId;

    @TableField("claimed_at")
    private LocalDateTime claimedAt;
}
