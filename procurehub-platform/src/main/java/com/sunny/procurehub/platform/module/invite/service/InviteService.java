package com.sunny.procurehub.platform.module.invite.service;

import com.baomidou.mybatisplus.core.metadata.IPage;
import com.sunny.procurehub.platform.module.invite.dto.InviteDto;
import com.sunny.procurehub.platform.module.invite.entity.Invite;
import com.sunny.procurehub.platform.module.invite.enums.ConsumeOutcome;
import java.util.Optional;

/**
 * 邀请服务
 */
public interface InviteService {

    Optional<Invite> findByCode(String normalizedCode);

    /**
     * 行锁下复核并消费一次；并发竞争失败返回 LOST_RACE，调用方需回滚已做的工作
     */
    ConsumeOutcome atomicConsume(Long inviteId, Long userId);

    InviteDto.CreateResponse createInvite(Long inviterId, InviteDto.Create dto);

    InviteDto.Validation validateInvite(String rawCode, String email, String clientIp);

    IPage<Invite> listInvites(Long inviterId, int limit, int offset);

    Optional<InviteDto.CompanyTarget> companyTarget(Invite invite);
}
