package com.sunny.procurehub.platform.module.approval.model;

import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import com.sunny.procurehub.platform.security.AuthContext;

/**
 * 审批操作人；系统任务使用 SYSTEM
 *
 * @author Sunny
 * @date 2026-03-02
 */
public record ApprovalActor(Long userId, Long companyId, Long teamId, OrgRole role, boolean system) {

    public static final ApprovalActor SYSTEM = new ApprovalActor(null, null, null, null, true);

    public static ApprovalActor of(AuthContext context) {
        return new ApprovalActor(context.userId(), context.companyId(), context.teamId(), context.role(), false);
    }

    public boolean isAdminOrOwner() {
        return role != null && role.isAdminOrOwner();
    }

    public boolean belongsTo(Long targetCompanyId) {
        return companyId != null && companyId.equals(targetCompanyId);
    }
}
