package com.sunny.procurehub.platform.module.ledger.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 公司积分账户
 * totalCredits 与 bonusCredits 是订阅基线，只保存在账户头
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("credit_accounts")
public class CreditAccount {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("company_id")
    private Long companyId;

    @TableField("subscription_tier")
    private String subscriptionTier;

    @TableField("period_start")
    private LocalDateTime periodStart;

    @TableField("period_end")
    private LocalDateTime periodEnd;

    @TableField("total_credits")
    private Long totalCredits;

    @TableField("bonus_credits")
    private Long bonusCredits;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
