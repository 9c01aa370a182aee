package com.sunny.procurehub.platform.module.approval.model;

import com.sunny.procurehub.platform.module.approval.enums.ApprovalLevel;

/**
 * 路由结果；ruleId 为空表示命中内置默认规则
 *
 * @author Sunny
 * @date 2026-03-02
 */
public record RoutedRule(Long ruleId, ApprovalLevel level, Integer escalationHours, ApprovalLevel escalateTo) {

    public boolean isAuto() {
        return level == ApprovalLevel.AUTO;
    }

    public boolean canEscalateFrom(ApprovalLevel current) {
        return escalateTo != null && escalateTo.isAbove(current);
    }
}
