package com.sunny.procurehub.platform.module.ledger.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.procurehub.platform.module.ledger.enums.HoldStatus;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 积分冻结，与审批请求一一对应
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("credit_holds")
public class CreditHold {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("account_id")
    private Long accountId;

    @TableField("request_id")
    private Long requestId;

    @TableField("amount")
    private Long amount;

    @TableField("status")
    private HoldStatus status;

    @TableField("idempotency_key")
    private String idempotencyKey;

    @TableField("actor_id")
    private Long actorId;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("converted_at")
    private LocalDateTime convertedAt;

    @TableField("released_at")
    private LocalDateTime releasedAt;
}
