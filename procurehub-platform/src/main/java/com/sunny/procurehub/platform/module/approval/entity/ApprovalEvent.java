package com.sunny.procurehub.platform.module.approval.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalEventType;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalStatus;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 审批事件，与状态变更在同一事务中追加
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("approval_events")
public class ApprovalEvent {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("request_id")
    private Long requestId;

    @TableField("event_type")
    private ApprovalEventType eventType;

    @TableField("performed_by")
    private Long performedBy;

    @TableField("performed_by_system")
    private Boolean performedBySystem;

    @TableField("from_status")
    private ApprovalStatus fromStatus;

    @TableField("to_status")
    private ApprovalStatus toStatus;

    @TableField("reason")
    private String reason;

    @TableField("metadata")
    private String metadata;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
