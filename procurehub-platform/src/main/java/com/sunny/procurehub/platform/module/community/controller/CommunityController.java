package com.sunny.procurehub.platform.module.community.controller;

import com.sunny.procurehub.common.exception.ForbiddenException;
import com.sunny.procurehub.common.response.ApiResponse;
import com.sunny.procurehub.platform.module.community.dto.CommunityDto;
import com.sunny.procurehub.platform.module.community.entity.Answer;
import com.sunny.procurehub.platform.module.community.entity.Question;
import com.sunny.procurehub.platform.module.community.model.AwardedBadge;
import com.sunny.procurehub.platform.module.community.service.CommunityService;
import com.sunny.procurehub.platform.module.permission.PermissionSet;
import com.sunny.procurehub.platform.security.AuthContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 社区控制器
 * 能力校验使用会话解析出的权限集合
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Tag(name = "社区", description = "问答、投票与徽章接口")
@RestController
@RequestMapping("/community")
@RequiredArgsConstructor
public class CommunityController {

    private final CommunityService communityService;

    @Operation(summary = "提问")
    @PostMapping("/questions")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<CommunityDto.QuestionResponse> ask(@Valid @RequestBody CommunityDto.QuestionCreate dto,
                                                          HttpServletRequest request) {
        AuthContext context = AuthContext.require(request);
        if (!permissions(context).canAsk()) {
            throw new ForbiddenException("当前账号暂无提问权限");
        }
        return ApiResponse.ok(toQuestionResponse(communityService.postQuestion(context.userId(), dto)));
    }

    @Operation(summary = "回答")
    @PostMapping("/questions/{id}/answers")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<CommunityDto.AnswerResponse> answer(@PathVariable Long id,
                                                           @Valid @RequestBody CommunityDto.AnswerCreate dto,
                                                           HttpServletRequest request) {
        AuthContext context = AuthContext.require(request);
        if (!permissions(context).canAnswer()) {
            throw new ForbiddenException("当前账号暂无回答权限");
        }
        return ApiResponse.ok(toAnswerResponse(communityService.postAnswer(context.userId(), id, dto)));
    }

    @Operation(summary = "投票")
    @PostMapping("/votes")
    public ApiResponse<CommunityDto.VoteResult> vote(@Valid @RequestBody CommunityDto.VoteRequest dto,
                                                     HttpServletRequest request) {
        AuthContext context = AuthContext.require(request);
        PermissionSet permissions = permissions(context);
        boolean allowed = dto.getValue() != null && dto.getValue() < 0
                ? permissions.canDownvote()
                : permissions.canUpvote();
        if (!allowed) {
            throw new ForbiddenException("声望不足，暂不能投票");
        }
        return ApiResponse.ok(communityService.castVote(context.userId(), dto));
    }

    @Operation(summary = "采纳回答")
    @PostMapping("/answers/{id}/accept")
    public ApiResponse<CommunityDto.AcceptResult> accept(@PathVariable Long id, HttpServletRequest request) {
        AuthContext context = AuthContext.require(request);
        return ApiResponse.ok(communityService.acceptAnswer(context.userId(), id));
    }

    @Operation(summary = "用户徽章")
    @GetMapping("/users/{id}/badges")
    public ApiResponse<List<CommunityDto.BadgeResponse>> badges(@PathVariable Long id) {
        List<CommunityDto.BadgeResponse> badges = communityService.listBadges(id).stream()
                .map(this::toBadgeResponse)
                .toList();
        return ApiResponse.ok(badges);
    }

    private PermissionSet permissions(AuthContext context) {
        return context.permissions() == null ? PermissionSet.ANONYMOUS : context.permissions();
    }

    private CommunityDto.QuestionResponse toQuestionResponse(Question question) {
        CommunityDto.QuestionResponse response = new CommunityDto.QuestionResponse();
        response.setId(question.getId());
        response.setAuthorId(question.getAuthorId());
        response.setTitle(question.getTitle());
        response.setBody(question.getBody());
        response.setScore(question.getScore());
        response.setAcceptedAnswerId(question.getAcceptedAnswerId());
        response.setCreatedAt(question.getCreatedAt());
        return response;
    }

    private CommunityDto.AnswerResponse toAnswerResponse(Answer answer) {
        CommunityDto.AnswerResponse response = new CommunityDto.AnswerResponse();
        response.setId(answer.getId());
        response.setQuestionId(answer.getQuestionId());
        response.setAuthorId(answer.getAuthorId());
        response.setBody(answer.getBody());
        response.setScore(answer.getScore());
        response.setAccepted(Boolean.TRUE.equals(answer.getAccepted()));
        response.setCreatedAt(answer.getCreatedAt());
        return response;
    }

    private CommunityDto.BadgeResponse toBadgeResponse(AwardedBadge badge) {
        CommunityDto.BadgeResponse response = new CommunityDto.BadgeResponse();
        response.setBadgeId(badge.getBadgeId());
        response.setSlug(badge.getSlug());
        response.setName(badge.getName());
        response.setDescription(badge.getDescription());
        response.setTier(badge.getTier());
        response.setAwardedAt(badge.getAwardedAt());
        return response;
    }
}
