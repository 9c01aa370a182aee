package com.sunny.procurehub.platform.module.approval.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalLevel;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalStatus;
import com.sunny.procurehub.platform.module.approval.enums.RequestType;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 审批请求
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("approval_requests")
public class ApprovalRequest {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("company_id")
    private Long companyId;

    @TableField("team_id")
    private Long teamId;

    @TableField("requester_id")
    private Long requesterId;

    @TableField("request_type")
    private RequestType requestType;

    @TableField("status")
    private ApprovalStatus status;

    @TableField("title")
    private String title;

    @TableField("description")
    private String description;

    @TableField("estimated_credits")
    private Long estimatedCredits;

    @TableField("actual_credits")
    private Long actualCredits;

    /**
     * JSON
     */
    @TableField("context")
    private String context;

    @TableField("current_approver_id")
    private Long currentApproverId;

    @TableField("approval_level")
    private ApprovalLevel approvalLevel;

    @TableField("escalation_count")
    private Integer escalationCount;

    @TableField("decision_reason")
    private String decisionReason;

    @TableField("decided_by")
    private Long decidedBy;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("submitted_at")
    private LocalDateTime submittedAt;

    @TableField("decided_at")
    private LocalDateTime decidedAt;

    @TableField("fulfilled_at")
    private LocalDateTime fulfilledAt;

    @TableField("expires_at")
    private LocalDateTime expiresAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
