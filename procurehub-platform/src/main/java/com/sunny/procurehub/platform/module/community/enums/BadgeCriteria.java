package com.sunny.procurehub.platform.module.community.enums;

import com.sunny.procurehub.platform.module.community.model.UserStats;
import java.util.Optional;
import java.util.function.ToLongFunction;
import lombok.Getter;

/**
 * 徽章判定条件
 * 新增条件只需在此追加指标，授予流程不变
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum BadgeCriteria {

    FIRST_QUESTION("first_question", UserStats::questionCount),
    FIRST_ANSWER("first_answer", UserStats::answerCount),
    QUESTION_COUNT("question_count", UserStats::questionCount),
    ANSWER_COUNT("answer_count", UserStats::answerCount),
    ACCEPTED_COUNT("accepted_count", UserStats::acceptedCount),
    UPVOTES_RECEIVED("upvotes_received", UserStats::upvotesReceived),
    REPUTATION("reputation", UserStats::reputation),
    VOTES_CAST("votes_cast", UserStats::votesCast),
    STREAK_DAYS("streak_days", UserStats::currentStreak),
    LONGEST_STREAK("longest_streak", UserStats::longestStreak),
    QUESTION_SCORE("question_score", UserStats::maxQuestionScore),
    ANSWER_SCORE("answer_score", UserStats::maxAnswerScore);

    private final String code;

    private final ToLongFunction<UserStats> metric;

    BadgeCriteria(String code, ToLongFunction<UserStats> metric) {
        this.code = code;
        this.metric = metric;
    }

    /**
     * 阈值小于 1 按 1 处理
     */
    public boolean isMet(UserStats stats, Integer threshold) {
        long required = threshold == null ? 1L : Math.max(1, threshold);
        return metric.applyAsLong(stats) >= required;
    }

    public static Optional<BadgeCriteria> fromCode(String code) {
        for (BadgeCriteria criteria : values()) {
            if (criteria.code.equalsIgnoreCase(code)) {
                return Optional.of(criteria);
            }
        }
        return Optional.empty();
    }
}
