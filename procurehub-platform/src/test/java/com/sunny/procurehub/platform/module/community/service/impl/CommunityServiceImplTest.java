package com.sunny.procurehub.platform.module.community.service.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
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
import com.sunny.procurehub.platform.module.community.service.BadgeEvaluator;
import com.sunny.procurehub.platform.module.community.service.ReputationService;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CommunityServiceImplTest {

    private static final Long VOTER_ID = 2L;
    private static final Long AUTHOR_ID = 3L;
    private static final Long ANSWER_ID = 40L;

    @Mock
    private QuestionMapper questionMapper;
    @Mock
    private AnswerMapper answerMapper;
    @Mock
    private VoteMapper voteMapper;
    @Mock
    private UserBadgeMapper userBadgeMapper;
    @Mock
    private ReputationService reputationService;
    @Mock
    private BadgeEvaluator badgeEvaluator;
    @Mock
    private TransactionExecutor transactionExecutor;

    private CommunityServiceImpl communityService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC);
        communityService = new CommunityServiceImpl(questionMapper, answerMapper, voteMapper, userBadgeMapper,
                reputationService, badgeEvaluator, transactionExecutor, clock);
        lenient().when(transactionExecutor.execute(any(DbScene.class), any()))
                .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(1)).get());
    }

    @Test
    void castVote_shouldRejectVoteOnOwnContent() {
        when(answerMapper.selectByIdForUpdate(ANSWER_ID)).thenReturn(answer(ANSWER_ID, VOTER_ID, 0));

        assertThrows(VoteRejectedException.class,
                () -> communityService.castVote(VOTER_ID, vote("answer", ANSWER_ID, 1)));
        verify(voteMapper, never()).insert(any(Vote.class));
        verify(reputationService, never()).apply(any(), any(), anyBoolean(), any(), any());
    }

    @Test
    void castVote_shouldRejectValueOutsideRange() {
        assertThrows(VoteRejectedException.class,
                () -> communityService.castVote(VOTER_ID, vote("answer", ANSWER_ID, 2)));
        assertThrows(VoteRejectedException.class,
                () -> communityService.castVote(VOTER_ID, vote("comment", ANSWER_ID, 1)));
    }

    @Test
    void castVote_shouldCreditAuthorOnFirstUpvote() {
        when(answerMapper.selectByIdForUpdate(ANSWER_ID)).thenReturn(answer(ANSWER_ID, AUTHOR_ID, 0));
        when(voteMapper.selectOne(any(LambdaQueryWrapper.class))).thenReturn(null);
        when(answerMapper.selectById(ANSWER_ID)).thenReturn(answer(ANSWER_ID, AUTHOR_ID, 1));
        Badge badge = new Badge();
        badge.setSlug("first-upvote");
        when(badgeEvaluator.evaluate(VOTER_ID)).thenReturn(List.of());
        when(badgeEvaluator.evaluate(AUTHOR_ID)).thenReturn(List.of(badge));

        CommunityDto.VoteResult result = communityService.castVote(VOTER_ID, vote("answer", ANSWER_ID, 1));

        assertEquals("cast", result.getOutcome());
        assertEquals(1, result.getVoteValue());
        assertEquals(1, result.getScore());
        assertEquals(List.of("first-upvote"), result.getAwardedBadges());
        verify(answerMapper).adjustScore(ANSWER_ID, 1);
        verify(reputationService).apply(AUTHOR_ID, ReputationReason.ANSWER_UPVOTED, false, "answer", ANSWER_ID);
        verify(reputationService).recordActivity(VOTER_ID);
        InOrder evaluations = inOrder(badgeEvaluator);
        evaluations.verify(badgeEvaluator).evaluate(VOTER_ID);
        evaluations.verify(badgeEvaluator).evaluate(AUTHOR_ID);
    }

    @Test
    void castVote_shouldRemoveVoteWhenSameValueRepeated() {
        when(questionMapper.selectByIdForUpdate(10L)).thenReturn(question(10L, AUTHOR_ID, null));
        Vote existing = existingVote(VoteTargetType.QUESTION, 10L, 1);
        when(voteMapper.selectOne(any(LambdaQueryWrapper.class))).thenReturn(existing);
        when(questionMapper.selectById(10L)).thenReturn(question(10L, AUTHOR_ID, null));

        CommunityDto.VoteResult result = communityService.castVote(VOTER_ID, vote("question", 10L, 1));

        assertEquals("removed", result.getOutcome());
        assertEquals(0, result.getVoteValue());
        verify(voteMapper).deleteById(existing.getId());
        verify(questionMapper).adjustScore(10L, -1);
        verify(reputationService).apply(AUTHOR_ID, ReputationReason.QUESTION_UPVOTED, true, "question", 10L);
    }

    @Test
    void castVote_shouldReverseOldEffectsBeforeApplyingSwitchedVote() {
        when(answerMapper.selectByIdForUpdate(ANSWER_ID)).thenReturn(answer(ANSWER_ID, AUTHOR_ID, 1));
        when(voteMapper.selectOne(any(LambdaQueryWrapper.class)))
                .thenReturn(existingVote(VoteTargetType.ANSWER, ANSWER_ID, 1));
        when(answerMapper.selectById(ANSWER_ID)).thenReturn(answer(ANSWER_ID, AUTHOR_ID, -1));

        CommunityDto.VoteResult result = communityService.castVote(VOTER_ID, vote("answer", ANSWER_ID, -1));

        assertEquals("switched", result.getOutcome());
        assertEquals(-1, result.getVoteValue());
        assertEquals(-1, result.getScore());
        InOrder order = inOrder(answerMapper, reputationService, voteMapper);
        order.verify(answerMapper).adjustScore(ANSWER_ID, -1);
        order.verify(reputationService).apply(AUTHOR_ID, ReputationReason.ANSWER_UPVOTED, true, "answer", ANSWER_ID);
        order.verify(voteMapper).update(isNull(), any());
        order.verify(answerMapper).adjustScore(ANSWER_ID, -1);
        order.verify(reputationService).apply(AUTHOR_ID, ReputationReason.DOWNVOTE_RECEIVED, false, "answer",
                ANSWER_ID);
        order.verify(reputationService).apply(VOTER_ID, ReputationReason.DOWNVOTE_CAST, false, "answer", ANSWER_ID);
    }

    @Test
    void acceptAnswer_shouldRejectWhenUserIsNotQuestionAuthor() {
        when(answerMapper.selectById(ANSWER_ID)).thenReturn(answer(ANSWER_ID, AUTHOR_ID, 0));
        when(questionMapper.selectByIdForUpdate(10L)).thenReturn(question(10L, 99L, null));

        assertThrows(ForbiddenException.class, () -> communityService.acceptAnswer(VOTER_ID, ANSWER_ID));
    }

    @Test
    void acceptAnswer_shouldRejectOwnAnswer() {
        when(answerMapper.selectById(ANSWER_ID)).thenReturn(answer(ANSWER_ID, VOTER_ID, 0));
        when(questionMapper.selectByIdForUpdate(10L)).thenReturn(question(10L, VOTER_ID, null));

        assertThrows(InvalidInputException.class, () -> communityService.acceptAnswer(VOTER_ID, ANSWER_ID));
    }

    @Test
    void acceptAnswer_shouldBeNoOpWhenAlreadyAccepted() {
        when(answerMapper.selectById(ANSWER_ID)).thenReturn(answer(ANSWER_ID, AUTHOR_ID, 0));
        when(questionMapper.selectByIdForUpdate(10L)).thenReturn(question(10L, VOTER_ID, ANSWER_ID));

        CommunityDto.AcceptResult result = communityService.acceptAnswer(VOTER_ID, ANSWER_ID);

        assertFalse(result.isChanged());
        verify(reputationService, never()).apply(any(), any(), anyBoolean(), any(), any());
    }

    @Test
    void acceptAnswer_shouldReversePreviousAcceptance() {
        Long previousId = 41L;
        Long previousAuthor = 4L;
        when(answerMapper.selectById(ANSWER_ID)).thenReturn(answer(ANSWER_ID, AUTHOR_ID, 0));
        when(questionMapper.selectByIdForUpdate(10L)).thenReturn(question(10L, VOTER_ID, previousId));
        when(answerMapper.selectByIdForUpdate(previousId)).thenReturn(answer(previousId, previousAuthor, 0));

        CommunityDto.AcceptResult result = communityService.acceptAnswer(VOTER_ID, ANSWER_ID);

        assertTrue(result.isChanged());
        assertEquals(previousId, result.getPreviousAnswerId());
        verify(reputationService).apply(previousAuthor, ReputationReason.ANSWER_ACCEPTED, true, "answer", previousId);
        verify(reputationService).apply(VOTER_ID, ReputationReason.ACCEPTED_ANSWER, true, "answer", previousId);
        verify(reputationService).apply(AUTHOR_ID, ReputationReason.ANSWER_ACCEPTED, false, "answer", ANSWER_ID);
        verify(reputationService).apply(VOTER_ID, ReputationReason.ACCEPTED_ANSWER, false, "answer", ANSWER_ID);
        verify(badgeEvaluator).evaluate(previousAuthor);
        verify(badgeEvaluator).evaluate(AUTHOR_ID);
    }

    @Test
    void postAnswer_shouldRejectUnknownQuestion() {
        CommunityDto.AnswerCreate dto = new CommunityDto.AnswerCreate();
        dto.setBody("可以先看供应商名录");
        when(questionMapper.selectById(anyLong())).thenReturn(null);

        assertThrows(NotFoundException.class,
                () -> communityService.postAnswer(AUTHOR_ID, 404L, dto));
        verify(answerMapper, never()).insert(any(Answer.class));
    }

    private CommunityDto.VoteRequest vote(String targetType, Long targetId, int value) {
        CommunityDto.VoteRequest request = new CommunityDto.VoteRequest();
        request.setTargetType(targetType);
        request.setTargetId(targetId);
        request.setValue(value);
        return request;
    }

    private Vote existingVote(VoteTargetType targetType, Long targetId, int value) {
        Vote vote = new Vote();
        vote.setId(70L);
        vote.setUserId(VOTER_ID);
        vote.setTargetType(targetType);
        vote.setTargetId(targetId);
        vote.setVoteValue(value);
        return vote;
    }

    private Answer answer(Long id, Long authorId, int score) {
        Answer answer = new Answer();
        answer.setId(id);
        answer.setQuestionId(10L);
        answer.setAuthorId(authorId);
        answer.setScore(score);
        answer.setAccepted(false);
        return answer;
    }

    private Question question(Long id, Long authorId, Long acceptedAnswerId) {
        Question question = new Question();
        question.setId(id);
        question.setAuthorId(authorId);
        question.setTitle("如何选择供应商");
        question.setScore(0);
        question.setAcceptedAnswerId(acceptedAnswerId);
        return question;
    }
}
