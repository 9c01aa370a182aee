package com.sunny.procurehub.platform.module.approval.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Data;

/**
 * 审批 DTO
 */
public class ApprovalDto {

    @Data
    @Schema(name = "ApprovalCreate")
    public static class Create {
        @NotBlank(message = "请求类型不能为空")
        private String requestType;

        @NotBlank(message = "标题不能为空")
        @Size(max = 200, message = "标题长度不能超过200个字符")
        private String title;

        @Size(max = 5000, message = "描述过长")
        private String description;

        @NotNull(message = "预估积分不能为空")
        @Min(value = 1, message = "预估积分必须大于0")
        private Long estimatedCredits;

        private Map<String, Object> context;
    }

    /**
     * 各动作按需取用：deny 需要 reason，fulfill 可带 actualCredits 与引用
     */
    @Data
    @Schema(name = "ApprovalTransition")
    public static class Transition {
        @Size(max = 500, message = "原因长度不能超过500个字符")
        private String reason;

        @Min(value = 1, message = "实际积分必须大于0")
        private Long actualCredits;

        @Size(max = 32, message = "引用类型过长")
        private String referenceType;

        @Size(max = 64, message = "引用ID过长")
        private String referenceId;
    }

    @Data
    @Schema(name = "ApprovalTransitionResult")
    public static class TransitionResult {
        private Long requestId;
        private String status;
        private String approvalLevel;
        private Long currentApproverId;
        private Long holdId;
    }

    @Data
    @Schema(name = "ApprovalRequest")
    public static class Response {
        private Long id;
        private Long companyId;
        private Long teamId;
        private Long requesterId;
        private String requestType;
        private String status;
        private String title;
        private String description;
        private Long estimatedCredits;
        private Long actualCredits;
        private String approvalLevel;
        private Long currentApproverId;
        private Integer escalationCount;
        private String decisionReason;
        private LocalDateTime createdAt;
        private LocalDateTime submittedAt;
        private LocalDateTime decidedAt;
        private LocalDateTime expiresAt;
    }

    @Data
    @Schema(name = "ApprovalEvent")
    public static class EventResponse {
        private Long id;
        private String eventType;
        private Long performedBy;
        private boolean performedBySystem;
        private String fromStatus;
        private String toStatus;
        private String reason;
        private String metadata;
        private LocalDateTime createdAt;
    }
}
