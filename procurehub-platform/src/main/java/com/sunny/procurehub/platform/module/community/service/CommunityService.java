package com.sunny.procurehub.platform.module.community.service;

import com.sunny.procurehub.platform.module.community.dto.CommunityDto;
import com.sunny.procurehub.platform.module.community.entity.Answer;
import com.sunny.procurehub.platform.module.community.entity.Question;
import com.sunny.procurehub.platform.module.community.model.AwardedBadge;
import java.util.List;

/**
 * 社区服务
 */
public interface CommunityService {

    Question postQuestion(Long authorId, CommunityDto.QuestionCreate dto);

    Answer postAnswer(Long authorId, Long questionId, CommunityDto.AnswerCreate dto);

    /**
     * 同值重复投票视为撤销，反向投票视为改票
     */
    CommunityDto.VoteResult castVote(Long voterId, CommunityDto.VoteRequest dto);

    CommunityDto.AcceptResult acceptAnswer(Long userId, Long answerId);

    List<AwardedBadge> listBadges(Long userId);
}
