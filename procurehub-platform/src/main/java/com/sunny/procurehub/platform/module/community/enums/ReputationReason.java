package com.sunny.procurehub.platform.module.community.enums;

import lombok.Getter;

/**
 * 声望变动原因与对应分值
 * 撤销时按相反分值记账，流水原因追加 _reversed
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum ReputationReason {

    QUESTION_UPVOTED("question_upvoted", 5),
    ANSWER_UPVOTED("answer_upvoted", 10),
    DOWNVOTE_RECEIVED("downvote_received", -2),
    DOWNVOTE_CAST("downvote_cast", -1),
    ANSWER_ACCEPTED("answer_accepted", 15),
    ACCEPTED_ANSWER("accepted_answer", 2);

    private static final String REVERSED_SUFFIX = "_reversed";

    private final String code;

    private final int delta;

    ReputationReason(String code, int delta) {
        this.code = code;
        this.delta = delta;
    }

    public int deltaFor(boolean reversal) {
        return reversal ? -delta : delta;
    }

    public String logReason(boolean reversal) {
        return reversal ? code + REVERSED_SUFFIX : code;
    }

    public static ReputationReason upvoteReceived(VoteTargetType targetType) {
        return targetType == VoteTargetType.QUESTION ? QUESTION_UPVOTED : ANSWER_UPVOTED;
    }
}
