package com.sunny.procurehub.platform.module.approval.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalLevel;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 公司审批路由规则
 * priority 越小越先匹配，maxCredits 为空表示无上限
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("approval_rules")
public class ApprovalRule {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    @TableField("company_id")
    private Long companyId;

    @TableField("name")
    private String name;

    @TableField("min_credits")
    private Long minCredits;

    @TableField("max_credits")
    private Long maxCredits;

    @TableField("approver_role")
    private ApprovalLevel approverRole;

    @TableField("escalation_hours")
    private Integer escalationHours;

    @TableField("escalate_to")
    private ApprovalLevel escalateTo;

    @TableField("priority")
    private Integer priority;

    @TableField("is_active")
    private Boolean active;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
