package com.sunny.procurehub.platform.module.community.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import com.sunny.procurehub.platform.module.community.entity.Badge;
import com.sunny.procurehub.platform.module.community.entity.UserBadge;
import com.sunny.procurehub.platform.module.community.mapper.AnswerMapper;
import com.sunny.procurehub.platform.module.community.mapper.BadgeMapper;
import com.sunny.procurehub.platform.module.community.mapper.QuestionMapper;
import com.sunny.procurehub.platform.module.community.mapper.UserBadgeMapper;
import com.sunny.procurehub.platform.module.community.mapper.VoteMapper;
import com.sunny.procurehub.platform.module.user.mapper.ProfileMapper;
import com.sunny.procurehub.platform.storage.InsertResult;
import com.sunny.procurehub.platform.storage.TransactionExecutor;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BadgeEvaluatorTest {

    private static final Long USER_ID = 7L;

    @Mock
    private BadgeMapper badgeMapper;
    @Mock
    private UserBadgeMapper userBadgeMapper;
    @Mock
    private QuestionMapper questionMapper;
    @Mock
    private AnswerMapper answerMapper;
    @Mock
    private VoteMapper voteMapper;
    @Mock
    private ProfileMapper profileMapper;
    @Mock
    private TransactionExecutor transactionExecutor;

    private BadgeEvaluator badgeEvaluator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC);
        badgeEvaluator = new BadgeEvaluator(badgeMapper, userBadgeMapper, questionMapper, answerMapper, voteMapper,
                profileMapper, transactionExecutor, clock);
        lenient().when(transactionExecutor.execute(any(DbScene.class), any()))
                .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(1)).get());
        lenient().when(questionMapper.selectCount(any(LambdaQueryWrapper.class))).thenReturn(1L);
    }

    @Test
    void evaluate_shouldAwardBadgeOnceAcrossRepeatedEvaluations() {
        Badge curious = badge(3L, "curious", "first_question", 1);
        when(badgeMapper.selectList(any(LambdaQueryWrapper.class))).thenReturn(List.of(curious));
        when(userBadgeMapper.selectList(any(LambdaQueryWrapper.class)))
                .thenReturn(List.of())
                .thenReturn(List.of(owned(curious)));
        when(transactionExecutor.insertOrConflict(any())).thenAnswer(invocation -> {
            ((Runnable) invocation.getArgument(0)).run();
            return InsertResult.inserted();
        });

        List<Badge> first = badgeEvaluator.evaluate(USER_ID);
        List<Badge> second = badgeEvaluator.evaluate(USER_ID);

        assertEquals(List.of(curious), first);
        assertTrue(second.isEmpty());
        verify(userBadgeMapper, times(1)).insert(any(UserBadge.class));
    }

    @Test
    void evaluate_shouldSkipBadgeAlreadyOwned() {
        Badge curious = badge(3L, "curious", "first_question", 1);
        when(badgeMapper.selectList(any(LambdaQueryWrapper.class))).thenReturn(List.of(curious));
        when(userBadgeMapper.selectList(any(LambdaQueryWrapper.class))).thenReturn(List.of(owned(curious)));

        assertTrue(badgeEvaluator.evaluate(USER_ID).isEmpty());
        verify(transactionExecutor, never()).insertOrConflict(any());
    }

    @Test
    void evaluate_shouldNotReportBadgeWhenConcurrentAwardWins() {
        Badge curious = badge(3L, "curious", "first_question", 1);
        when(badgeMapper.selectList(any(LambdaQueryWrapper.class))).thenReturn(List.of(curious));
        when(userBadgeMapper.selectList(any(LambdaQueryWrapper.class))).thenReturn(List.of());
        when(transactionExecutor.insertOrConflict(any())).thenReturn(InsertResult.conflict("uq_user_badges"));

        assertTrue(badgeEvaluator.evaluate(USER_ID).isEmpty());
        verify(transactionExecutor).insertOrConflict(any());
    }

    @Test
    void evaluate_shouldIgnoreUnmetThresholdAndUnknownCriteria() {
        Badge prolific = badge(4L, "prolific", "question_count", 10);
        Badge legacy = badge(5L, "legacy", "retired_metric", 1);
        when(badgeMapper.selectList(any(LambdaQueryWrapper.class))).thenReturn(List.of(prolific, legacy));
        when(userBadgeMapper.selectList(any(LambdaQueryWrapper.class))).thenReturn(List.of());

        assertTrue(badgeEvaluator.evaluate(USER_ID).isEmpty());
        verify(transactionExecutor, never()).insertOrConflict(any());
    }

    private static Badge badge(Long id, String slug, String criteria, int threshold) {
        Badge badge = new Badge();
        badge.setId(id);
        badge.setSlug(slug);
        badge.setTier("bronze");
        badge.setCriteriaType(criteria);
        badge.setThreshold(threshold);
        return badge;
    }

    private static UserBadge owned(Badge badge) {
        UserBadge userBadge = new UserBadge();
        userBadge.setUserId(USER_ID);
        userBadge.setBadgeId(badge.getId());
        return userBadge;
    }
}
