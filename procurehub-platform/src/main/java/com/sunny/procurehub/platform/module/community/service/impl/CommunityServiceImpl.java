package com.sunny.procurehub.platform.module.community.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.sunny.procurehub.common.exception.ForbiddenException;
import com.sunny.procurehub.common.exception.NotFoundException;
import com.sunny.procurehub.platform.exception.auth.InvalidInputException;
import com.sunny.procurehub.platform.exception.community.VoteRejectedException;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.community.dto.CommunityDto;
import com.sunny.procurehub.platform.module.community.entity.Answer;
import com.sunny.procurehub.platform.module.community.entity.Badge;
import com.sunny.procurehub.platform.module.community.entity.Question;
import com.sunny.procurehub.platform.module.community.entity.Vote;
import com.sunny.procurehub.platform.module.community.enums.ReputationReason;
import com.sunny.procurehub.platform.module.community.enums.VoteTargetType;
import com.sunny.procurehub.platform.module.community.mapper.AnswerMapper;
import com.sunny.procurehub.platform.module.community.mapper.QuestionMapper;
import com.sunny.procurehub.platform.module.community.mapper.UserBadgeMapper;
import com.sunny.procurehub.platform.module.community.mapper.VoteMapper;
import com.sunny.procurehub.platform.module.community.model.AwardedBadge;
import com.sunny.procurehub.platform.module.community.service.BadgeEvaluator;
import com.sunny.procurehub.platform.module.community.service.CommunityService;
import com.sunny.procurehub.platform.module.community.service.ReputationService;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 社区服务实现
 *
 * <p>投票与采纳先锁目标行，声望变更、流水与徽章评估在同一事务内完成。
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommunityServiceImpl implements CommunityService {

    static final String OUTCOME_CAST = "cast";
    static final String OUTCOME_REMOVED = "removed";
    static final String OUTCOME_SWITCHED = "switched";

    private final QuestionMapper questionMapper;
    private final AnswerMapper answerMapper;
    private final VoteMapper voteMapper;
    private final UserBadgeMapper userBadgeMapper;
    private final ReputationService reputationService;
    private final BadgeEvaluator badgeEvaluator;
    private final TransactionExecutor transactionExecutor;
    private final Clock clock;

    @Override
    public Question postQuestion(Long authorId, CommunityDto.QuestionCreate dto) {
        if (dto == null || !StringUtils.hasText(dto.getTitle())) {
            throw new InvalidInputException("标题不能为空");
        }
        return transactionExecutor.execute(DbScene.COMMUNITY, () -> {
            Question question = new Question();
            question.setAuthorId(authorId);
            question.setTitle(dto.getTitle().trim());
            question.setBody(dto.getBody());
            question.setScore(0);
            question.setCreatedAt(LocalDateTime.now(clock));
            questionMapper.insert(question);

            reputationService.recordActivity(authorId);
            badgeEvaluator.evaluate(authorId);
            log.info("community_event event=question_posted questionId={} authorId={}", question.getId(), authorId);
            return question;
        });
    }

    @Override
    public Answer postAnswer(Long authorId, Long questionId, CommunityDto.AnswerCreate dto) {
        if (dto == null || !StringUtils.hasText(dto.getBody())) {
            throw new InvalidInputException("回答内容不能为空");
        }
        return transactionExecutor.execute(DbScene.COMMUNITY, () -> {
            if (questionMapper.selectById(questionId) == null) {
                throw new NotFoundException("问题不存在: %s", questionId);
            }
            Answer answer = new Answer();
            answer.setQuestionId(questionId);
            answer.setAuthorId(authorId);
            answer.setBody(dto.getBody());
            answer.setScore(0);
            answer.setAccepted(false);
            answer.setCreatedAt(LocalDateTime.now(clock));
            answerMapper.insert(answer);

            reputationService.recordActivity(authorId);
            badgeEvaluator.evaluate(authorId);
            log.info("community_event event=answer_posted answerId={} questionId={} authorId={}",
                    answer.getId(), questionId, authorId);
            return answer;
        });
    }

    @Override
    public CommunityDto.VoteResult castVote(Long voterId, CommunityDto.VoteRequest dto) {
        if (dto == null || dto.getTargetId() == null) {
            throw new InvalidInputException("投票目标不能为空");
        }
        VoteTargetType targetType = parseTargetType(dto.getTargetType());
        Integer value = dto.getValue();
        if (value == null || (value != 1 && value != -1)) {
            throw new VoteRejectedException("投票值只能是 1 或 -1");
        }

        return transactionExecutor.execute(DbScene.COMMUNITY, () -> {
            Long targetId = dto.getTargetId();
            Long authorId = lockTargetAuthor(targetType, targetId);
            if (authorId.equals(voterId)) {
                throw new VoteRejectedException("不能给自己的内容投票");
            }

            Vote existing = voteMapper.selectOne(new LambdaQueryWrapper<Vote>()
                    .eq(Vote::getUserId, voterId)
                    .eq(Vote::getTargetType, targetType)
                    .eq(Vote::getTargetId, targetId));
            String outcome;
            int effective;
            if (existing == null) {
                Vote vote = new Vote();
                vote.setUserId(voterId);
                vote.setTargetType(targetType);
                vote.setTargetId(targetId);
                vote.setVoteValue(value);
                vote.setCreatedAt(LocalDateTime.now(clock));
                voteMapper.insert(vote);
                applyVoteEffects(targetType, targetId, authorId, voterId, value, false);
                outcome = OUTCOME_CAST;
                effective = value;
            } else if (existing.getVoteValue().equals(value)) {
                voteMapper.deleteById(existing.getId());
                applyVoteEffects(targetType, targetId, authorId, voterId, value, true);
                outcome = OUTCOME_REMOVED;
                effective = 0;
            } else {
                applyVoteEffects(targetType, targetId, authorId, voterId, existing.getVoteValue(), true);
                LambdaUpdateWrapper<Vote> wrapper = new LambdaUpdateWrapper<>();
                wrapper.eq(Vote::getId, existing.getId())
                        .set(Vote::getVoteValue, value)
                        .set(Vote::getCreatedAt, LocalDateTime.now(clock));
                voteMapper.update(null, wrapper);
                applyVoteEffects(targetType, targetId, authorId, voterId, value, false);
                outcome = OUTCOME_SWITCHED;
                effective = value;
            }

            reputationService.recordActivity(voterId);
            List<String> awarded = new ArrayList<>();
            for (Long userId : new LinkedHashSet<>(List.of(voterId, authorId))) {
                badgeEvaluator.evaluate(userId).stream().map(Badge::getSlug).forEach(awarded::add);
            }

            CommunityDto.VoteResult result = new CommunityDto.VoteResult();
            result.setTargetType(targetType.getCode());
            result.setTargetId(targetId);
            result.setVoteValue(effective);
            result.setScore(currentScore(targetType, targetId));
            result.setOutcome(outcome);
            result.setAwardedBadges(awarded);
            log.info("community_event event=vote_{} voterId={} targetType={} targetId={} value={} authorId={}",
                    outcome, voterId, targetType.getCode(), targetId, value, authorId);
            return result;
        });
    }

    @Override
    public CommunityDto.AcceptResult acceptAnswer(Long userId, Long answerId) {
        return transactionExecutor.execute(DbScene.COMMUNITY, () -> {
            Answer candidate = answerMapper.selectById(answerId);
            if (candidate == null) {
                throw new NotFoundException("回答不存在: %s", answerId);
            }
            Question question = questionMapper.selectByIdForUpdate(candidate.getQuestionId());
            if (question == null) {
                throw new NotFoundException("问题不存在: %s", candidate.getQuestionId());
            }
            if (!question.getAuthorId().equals(userId)) {
                throw new ForbiddenException("只有提问者可以采纳回答");
            }
            if (candidate.getAuthorId().equals(userId)) {
                throw new InvalidInputException("不能采纳自己的回答");
            }

            CommunityDto.AcceptResult result = new CommunityDto.AcceptResult();
            result.setQuestionId(question.getId());
            result.setAnswerId(answerId);
            Long previousId = question.getAcceptedAnswerId();
            result.setPreviousAnswerId(previousId);
            if (answerId.equals(previousId)) {
                result.setChanged(false);
                return result;
            }

            Set<Long> affected = new LinkedHashSet<>();
            affected.add(userId);
            if (previousId != null) {
                Answer previous = answerMapper.selectByIdForUpdate(previousId);
                if (previous != null) {
                    markAccepted(previous.getId(), false);
                    reputationService.apply(previous.getAuthorId(), ReputationReason.ANSWER_ACCEPTED, true,
                            VoteTargetType.ANSWER.getCode(), previous.getId());
                    reputationService.apply(userId, ReputationReason.ACCEPTED_ANSWER, true,
                            VoteTargetType.ANSWER.getCode(), previous.getId());
                    affected.add(previous.getAuthorId());
                }
            }

            markAccepted(answerId, true);
            LambdaUpdateWrapper<Question> wrapper = new LambdaUpdateWrapper<>();
            wrapper.eq(Question::getId, question.getId())
                    .set(Question::getAcceptedAnswerId, answerId);
            questionMapper.update(null, wrapper);
            reputationService.apply(candidate.getAuthorId(), ReputationReason.ANSWER_ACCEPTED, false,
                    VoteTargetType.ANSWER.getCode(), answerId);
            reputationService.apply(userId, ReputationReason.ACCEPTED_ANSWER, false,
                    VoteTargetType.ANSWER.getCode(), answerId);
            affected.add(candidate.getAuthorId());

            affected.forEach(badgeEvaluator::evaluate);
            result.setChanged(true);
            log.info("community_event event=answer_accepted questionId={} answerId={} previousAnswerId={} accepterId={}",
                    question.getId(), answerId, previousId, userId);
            return result;
        });
    }

    @Override
    public List<AwardedBadge> listBadges(Long userId) {
        return userBadgeMapper.selectAwardedByUser(userId);
    }

    private void applyVoteEffects(VoteTargetType targetType, Long targetId, Long authorId, Long voterId,
                                  int value, boolean reversal) {
        int scoreDelta = reversal ? -value : value;
        if (targetType == VoteTargetType.QUESTION) {
            questionMapper.adjustScore(targetId, scoreDelta);
        } else {
            answerMapper.adjustScore(targetId, scoreDelta);
        }
        String referenceType = targetType.getCode();
        if (value > 0) {
            reputationService.apply(authorId, ReputationReason.upvoteReceived(targetType), reversal,
                    referenceType, targetId);
            return;
        }
        reputationService.apply(authorId, ReputationReason.DOWNVOTE_RECEIVED, reversal, referenceType, targetId);
        reputationService.apply(voterId, ReputationReason.DOWNVOTE_CAST, reversal, referenceType, targetId);
    }

    private Long lockTargetAuthor(VoteTargetType targetType, Long targetId) {
        if (targetType == VoteTargetType.QUESTION) {
            Question question = questionMapper.selectByIdForUpdate(targetId);
            if (question == null) {
                throw new NotFoundException("问题不存在: %s", targetId);
            }
            return question.getAuthorId();
        }
        Answer answer = answerMapper.selectByIdForUpdate(targetId);
        if (answer == null) {
            throw new NotFoundException("回答不存在: %s", targetId);
        }
        return answer.getAuthorId();
    }

    private int currentScore(VoteTargetType targetType, Long targetId) {
        Integer score = targetType == VoteTargetType.QUESTION
                ? questionMapper.selectById(targetId).getScore()
                : answerMapper.selectById(targetId).getScore();
        return score == null ? 0 : score;
    }

    private void markAccepted(Long answerId, boolean accepted) {
        LambdaUpdateWrapper<Answer> wrapper = new LambdaUpdateWrapper<>();
        wrapper.eq(Answer::getId, answerId)
                .set(Answer::getAccepted, accepted);
        answerMapper.update(null, wrapper);
    }

    private VoteTargetType parseTargetType(String code) {
        if (!StringUtils.hasText(code)) {
            throw new VoteRejectedException("投票目标类型不能为空");
        }
        try {
            return VoteTargetType.fromCode(code.trim());
        } catch (IllegalArgumentException ex) {
            throw new VoteRejectedException("不支持的投票目标类型: " + code);
        }
    }
}
