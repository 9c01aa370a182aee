package com.sunny.procurehub.platform.module.organization.service;

import com.sunny.procurehub.platform.module.organization.entity.CompanyMember;
import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import java.util.List;
import java.util.Optional;

/**
 * 组织服务
 */
public interface OrganizationService {

    Optional<CompanyMember> findMembership(Long userId);

    CompanyMember addMember(Long companyId, Long userId, Long teamId, OrgRole role);

    /**
     * 按 eligibleRoles 的顺序挑选审批人，同角色优先选择 preferredTeamId 内的成员，永不返回 excludedUserId
     */
    Optional<Long> findApprover(Long companyId, Long preferredTeamId, List<OrgRole> eligibleRoles, Long excludedUserId);
}
