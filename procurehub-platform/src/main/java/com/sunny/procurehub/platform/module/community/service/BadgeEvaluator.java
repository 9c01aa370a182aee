package com.sunny.procurehub.platform.module.community.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.community.entity.Answer;
import com.sunny.procurehub.platform.module.community.entity.Badge;
import com.sunny.procurehub.platform.module.community.entity.Question;
import com.sunny.procurehub.platform.module.community.entity.UserBadge;
import com.sunny.procurehub.platform.module.community.entity.Vote;
import com.sunny.procurehub.platform.module.community.enums.BadgeCriteria;
import com.sunny.procurehub.platform.module.community.mapper.AnswerMapper;
import com.sunny.procurehub.platform.module.community.mapper.BadgeMapper;
import com.sunny.procurehub.platform.module.community.mapper.QuestionMapper;
import com.sunny.procurehub.platform.module.community.mapper.UserBadgeMapper;
import com.sunny.procurehub.platform.module.community.mapper.VoteMapper;
import com.sunny.procurehub.platform.module.community.model.UserStats;
import com.sunny.procurehub.platform.module.user.entity.Profile;
import com.sunny.procurehub.platform.module.user.mapper.ProfileMapper;
import com.sunny.procurehub.platform.storage.InsertResult;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 徽章评估器
 * 基于最新统计遍历徽章目录，授予依赖 (user_id, badge_id) 唯一约束，并发下同一徽章只会落库一次
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BadgeEvaluator {

    private final BadgeMapper badgeMapper;
    private final UserBadgeMapper userBadgeMapper;
    private final QuestionMapper questionMapper;
    private final AnswerMapper answerMapper;
    private final VoteMapper voteMapper;
    private final ProfileMapper profileMapper;
    private final TransactionExecutor transactionExecutor;
    private final Clock clock;

    /**
     * 返回本次新授予的徽章
     */
    public List<Badge> evaluate(Long userId) {
        return transactionExecutor.execute(DbScene.COMMUNITY, () -> {
            UserStats stats = collectStats(userId);
            Set<Long> owned = userBadgeMapper.selectList(new LambdaQueryWrapper<UserBadge>()
                            .eq(UserBadge::getUserId, userId))
                    .stream()
                    .map(UserBadge::getBadgeId)
                    .collect(Collectors.toSet());

            List<Badge> awarded = new ArrayList<>();
            List<Badge> catalog = badgeMapper.selectList(new LambdaQueryWrapper<Badge>().orderByAsc(Badge::getId));
            for (Badge badge : catalog) {
                if (owned.contains(badge.getId())) {
                    continue;
                }
                Optional<BadgeCriteria> criteria = BadgeCriteria.fromCode(badge.getCriteriaType());
                if (criteria.isEmpty()) {
                    log.debug("community_event event=badge_criteria_unknown badge={} criteria={}",
                            badge.getSlug(), badge.getCriteriaType());
                    continue;
                }
                if (!criteria.get().isMet(stats, badge.getThreshold())) {
                    continue;
                }
                if (award(userId, badge)) {
                    awarded.add(badge);
                }
            }
            return awarded;
        });
    }

    public UserStats collectStats(Long userId) {
        Profile profile = profileMapper.selectById(userId);
        long questionCount = questionMapper.selectCount(new LambdaQueryWrapper<Question>()
                .eq(Question::getAuthorId, userId));
        long answerCount = answerMapper.selectCount(new LambdaQueryWrapper<Answer>()
                .eq(Answer::getAuthorId, userId));
        long acceptedCount = answerMapper.selectCount(new LambdaQueryWrapper<Answer>()
                .eq(Answer::getAuthorId, userId)
                .eq(Answer::getAccepted, true));
        long votesCast = voteMapper.selectCount(new LambdaQueryWrapper<Vote>()
                .eq(Vote::getUserId, userId));
        return new UserStats(
                questionCount,
                answerCount,
                acceptedCount,
                voteMapper.countUpvotesReceived(userId),
                votesCast,
                profile == null || profile.getReputation() == null ? 0 : profile.getReputation(),
                profile == null || profile.getCurrentStreak() == null ? 0 : profile.getCurrentStreak(),
                profile == null || profile.getLongestStreak() == null ? 0 : profile.getLongestStreak(),
                questionMapper.selectMaxScoreByAuthor(userId),
                answerMapper.selectMaxScoreByAuthor(userId));
    }

    private boolean award(Long userId, Badge badge) {
        UserBadge userBadge = new UserBadge();
        userBadge.setUserId(userId);
        userBadge.setBadgeId(badge.getId());
        userBadge.setAwardedAt(LocalDateTime.now(clock));
        InsertResult result = transactionExecutor.insertOrConflict(() -> userBadgeMapper.insert(userBadge));
        if (result.conflicted()) {
            log.debug("community_event event=badge_already_awarded userId={} badge={}", userId, badge.getSlug());
            return false;
        }
        log.info("community_event event=badge_awarded userId={} badge={} tier={}", userId, badge.getSlug(), badge.getTier());
        return true;
    }
}
