package com.sunny.procurehub.platform.module.ledger.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.procurehub.platform.module.ledger.enums.LedgerDirection;
import com.sunny.procurehub.platform.module.ledger.enums.TransactionType;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 账本分录，只追加不修改
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("ledger_entries")
public class LedgerEntry {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("account_id")
    private Long accountId;

    @TableField("direction")
    private LedgerDirection direction;

    @TableField("amount")
    private Long amount;

    @TableField("transaction_type")
    private TransactionType transactionType;

    @TableField("reference_type")
    private String referenceType;

    @TableField("reference_id")
    private String referenceId;

    @TableField("description")
    private String description;

    @TableField("idempotency_key")
    private String idempotencyKey;

    @TableField("actor_id")
    private Long actorId;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
