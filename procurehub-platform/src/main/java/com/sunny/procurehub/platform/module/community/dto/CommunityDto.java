package com.sunny.procurehub.platform.module.community.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Data;

/**
 * 社区 DTO
 */
public class CommunityDto {

    @Data
    @Schema(name = "CommunityQuestionCreate")
    public static class QuestionCreate {
        @NotBlank(message = "标题不能为空")
        @Size(max = 300, message = "标题长度不能超过300个字符")
        private String title;

        @Size(max = 20000, message = "内容过长")
        private String body;
    }

    @Data
    @Schema(name = "CommunityAnswerCreate")
    public static class AnswerCreate {
        @NotBlank(message = "回答内容不能为空")
        @Size(max = 20000, message = "内容过长")
        private String body;
    }

    @Data
    @Schema(name = "CommunityVote")
    public static class VoteRequest {
        @NotBlank(message = "投票目标类型不能为空")
        private String targetType;

        @NotNull(message = "投票目标不能为空")
        private Long targetId;

        /**
         * 1 赞同，-1 反对
         */
        @NotNull(message = "投票值不能为空")
        private Integer value;
    }

    @Data
    @Schema(name = "CommunityVoteResult")
    public static class VoteResult {
        private String targetType;
        private Long targetId;
        /**
         * 当前生效的投票值，撤销后为 0
         */
        private int voteValue;
        private int score;
        /**
         * cast / removed / switched
         */
        private String outcome;
        private List<String> awardedBadges;
    }

    @Data
    @Schema(name = "CommunityAcceptResult")
    public static class AcceptResult {
        private Long questionId;
        private Long answerId;
        private Long previousAnswerId;
        private boolean changed;
    }

    @Data
    @Schema(name = "CommunityQuestion")
    public static class QuestionResponse {
        private Long id;
        private Long authorId;
        private String title;
        private String body;
        private Integer score;
        private Long acceptedAnswerId;
        private LocalDateTime createdAt;
    }

    @Data
    @Schema(name = "CommunityAnswer")
    public static class AnswerResponse {
        private Long id;
        private Long questionId;
        private Long authorId;
        private String body;
        private Integer score;
        private boolean accepted;
        private LocalDateTime createdAt;
    }

    @Data
    @Schema(name = "CommunityBadge")
    public static class BadgeResponse {
        private Long badgeId;
        private String slug;
        private String name;
        private String description;
        private String tier;
        private LocalDateTime awardedAt;
    }
}
