package com.sunny.procurehub.platform.module.community.model;

/**
 * 徽章评估使用的用户统计快照
 *
 * @author Sunny
 * @date 2026-03-02
 */
public record UserStats(
        long questionCount,
        long answerCount,
        long acceptedCount,
        long upvotesReceived,
        long votesCast,
        long reputation,
        long currentStreak,
        long longestStreak,
        long maxQuestionScore,
        long maxAnswerScore) {
}
