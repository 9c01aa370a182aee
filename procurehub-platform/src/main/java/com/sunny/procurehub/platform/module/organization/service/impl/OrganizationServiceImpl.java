package com.sunny.procurehub.platform.module.organization.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.sunny.procurehub.platform.module.organization.entity.CompanyMember;
import com.sunny.procurehub.platform.module.organization.enums.OrgRole;
import com.sunny.procurehub.platform.module.organization.mapper.CompanyMemberMapper;
import com.sunny.procurehub.platform.module.organization.service.OrganizationService;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 组织服务实现
 */
@Service
@RequiredArgsConstructor
public class OrganizationServiceImpl implements OrganizationService {

    private final CompanyMemberMapper companyMemberMapper;
    private final Clock clock;

    @Override
    public Optional<CompanyMember> findMembership(Long userId) {
        if (userId == null) {
            return Optional.empty();
        }
        LambdaQueryWrapper<CompanyMember> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(CompanyMember::getUserId, userId);
        return Optional.ofNullable(companyMemberMapper.selectOne(wrapper));
    }

    @Override
    public CompanyMember addMember(Long companyId, Long userId, Long teamId, OrgRole role) {
        CompanyMember member = new CompanyMember();
        member.setCompanyId(companyId);
        member.setUserId(userId);
        member.setTeamId(teamId);
        member.setMemberRole(role == null ? OrgRole.MEMBER : role);
        member.setCreatedAt(LocalDateTime.now(clock));
        companyMemberMapper.insert(member);
        return member;
    }

    @Override
    public Optional<Long> findApprover(Long companyId,
                                       Long preferredTeamId,
                                       List<OrgRole> eligibleRoles,
                                       Long excludedUserId) {
        if (companyId == null || eligibleRoles == null || eligibleRoles.isEmpty()) {
            return Optional.empty();
        }
        LambdaQueryWrapper<CompanyMember> wrapper = new LambdaQueryWrapper<>();
        wrapper.eq(CompanyMember::getCompanyId, companyId)
                .in(CompanyMember::getMemberRole, eligibleRoles)
                .orderByAsc(CompanyMember::getId);
        if (excludedUserId != null) {
            wrapper.ne(CompanyMember::getUserId, excludedUserId);
        }
        List<CompanyMember> candidates = companyMemberMapper.selectList(wrapper);

        Comparator<CompanyMember> order = Comparator
                .comparingInt((CompanyMember member) -> eligibleRoles.indexOf(member.getMemberRole()))
                .thenComparing(member -> preferredTeamId != null && Objects.equals(preferredTeamId, member.getTeamId())
                        ? 0 : 1)
                .thenComparing(CompanyMember::getId);
        return candidates.stream()
                .min(order)
                .map(CompanyMember::getUserId);
    }
}
