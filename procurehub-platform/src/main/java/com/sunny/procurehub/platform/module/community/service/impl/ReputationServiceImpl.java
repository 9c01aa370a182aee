package com.sunny.procurehub.platform.module.community.service.impl;

import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.sunny.procurehub.common.exception.NotFoundException;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.community.entity.ReputationLog;
import com.sunny.procurehub.platform.module.community.enums.ReputationReason;
import com.sunny.procurehub.platform.module.community.mapper.ReputationLogMapper;
import com.sunny.procurehub.platform.module.community.service.ReputationService;
import com.sunny.procurehub.platform.module.user.entity.Profile;
import com.sunny.procurehub.platform.module.user.mapper.ProfileMapper;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 声望服务实现
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReputationServiceImpl implements ReputationService {

    private final ProfileMapper profileMapper;
    private final ReputationLogMapper reputationLogMapper;
    private final TransactionExecutor transactionExecutor;
    private final Clock clock;

    @Override
    public int apply(Long userId, ReputationReason reason, boolean reversal, String referenceType, Long referenceId) {
        int delta = reason.deltaFor(reversal);
        return transactionExecutor.execute(DbScene.COMMUNITY, () -> {
            LocalDateTime now = LocalDateTime.now(clock);
            if (profileMapper.applyReputationDelta(userId, delta, now) == 0) {
                throw new NotFoundException("用户资料不存在: %s", userId);
            }
            ReputationLog entry = new ReputationLog();
            entry.setUserId(userId);
            entry.setDelta(delta);
            entry.setReason(reason.logReason(reversal));
            entry.setReferenceType(referenceType);
            entry.setReferenceId(referenceId);
            entry.setCreatedAt(now);
            reputationLogMapper.insert(entry);

            log.info("community_event event=reputation_changed userId={} delta={} reason={} refType={} refId={}",
                    userId, delta, entry.getReason(), referenceType, referenceId);
            return delta;
        });
    }

    @Override
    public void recordActivity(Long userId) {
        transactionExecutor.run(DbScene.COMMUNITY, () -> {
            Profile profile = profileMapper.selectById(userId);
            if (profile == null) {
                throw new NotFoundException("用户资料不存在: %s", userId);
            }
            LocalDate today = LocalDate.now(clock);
            LocalDate lastActive = profile.getLastActiveDate();
            if (today.equals(lastActive)) {
                return;
            }
            int previous = profile.getCurrentStreak() == null ? 0 : profile.getCurrentStreak();
            int current = lastActive != null && lastActive.plusDays(1).equals(today) ? previous + 1 : 1;
            int longest = Math.max(current, profile.getLongestStreak() == null ? 0 : profile.getLongestStreak());

            LambdaUpdateWrapper<Profile> wrapper = new LambdaUpdateWrapper<>();
            wrapper.eq(Profile::getUserId, userId)
                    .set(Profile::getCurrentStreak, current)
                    .set(Profile::getLongestStreak, longest)
                    .set(Profile::getLastActiveDate, today)
                    .set(Profile::getUpdatedAt, LocalDateTime.now(clock));
            profileMapper.update(null, wrapper);
            log.debug("community_event event=activity_recorded userId={} streak={} longest={}", userId, current, longest);
        });
    }
}
