package com.sunny.procurehub.platform.module.approval.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.sunny.procurehub.platform.module.approval.entity.ApprovalRule;
import com.sunny.procurehub.platform.module.approval.enums.ApprovalLevel;
import com.sunny.procurehub.platform.module.approval.mapper.ApprovalRuleMapper;
import com.sunny.procurehub.platform.module.approval.model.RoutedRule;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 审批路由规则解析
 * 公司启用规则按 priority 升序匹配首个覆盖金额的区间，未命中时使用内置默认规则
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Component
@RequiredArgsConstructor
public class ApprovalRuleResolver {

    static final long AUTO_APPROVE_MAX = 499L;
    static final long APPROVER_MAX = 2000L;
    static final int APPROVER_ESCALATION_HOURS = 48;
    static final int ADMIN_ESCALATION_HOURS = 24;

    private final ApprovalRuleMapper approvalRuleMapper;

    public RoutedRule resolve(Long companyId, long estimatedCredits) {
        LambdaQueryWrapper<ApprovalRule> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(ApprovalRule::getCompanyId, companyId)
                .eq(ApprovalRule::getActive, true)
                .orderByAsc(ApprovalRule::getPriority)
                .orderByAsc(ApprovalRule::getId);
        List<ApprovalRule> rules = approvalRuleMapper.selectList(wrapper);
        for (ApprovalRule rule : rules) {
            if (brackets(rule, estimatedCredits)) {
                return new RoutedRule(rule.getId(), rule.getApproverRole(), rule.getEscalationHours(), rule.getEscalateTo());
            }
        }
        return defaultRule(estimatedCredits);
    }

    static RoutedRule defaultRule(long estimatedCredits) {
        if (estimatedCredits <= AUTO_APPROVE_MAX) {
            return new RoutedRule(null, ApprovalLevel.AUTO, null, null);
        }
        if (estimatedCredits <= APPROVER_MAX) {
            return new RoutedRule(null, ApprovalLevel.APPROVER, APPROVER_ESCALATION_HOURS, ApprovalLevel.ADMIN);
        }
        return new RoutedRule(null, ApprovalLevel.ADMIN, ADMIN_ESCALATION_HOURS, null);
    }

    private boolean brackets(ApprovalRule rule, long credits) {
        long min = rule.getMinCredits() == null ? 0L : rule.getMinCredits();
        return credits >= min && (rule.getMaxCredits() == null || credits <= rule.getMaxCredits());
    }
}
