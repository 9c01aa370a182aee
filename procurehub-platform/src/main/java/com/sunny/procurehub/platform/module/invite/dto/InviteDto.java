package com.sunny.procurehub.platform.module.invite.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.LocalDateTime;
import lombok.Data;

/**
 * 邀请 DTO
 */
public class InviteDto {

    @Data
    @Schema(name = "InviteCreate")
    public static class Create {
        @NotBlank(message = "邀请类型不能为空")
        @Pattern(regexp = "(?i)^(direct|link|company)$", message = "邀请类型不合法")
        private String type;

        @Size(max = 320, message = "邮箱长度不能超过320个字符")
        private String email;

        /**
         * 仅公司邀请使用
         */
        @Min(value = 1, message = "使用次数至少为1")
        @Max(value = 1000, message = "使用次数不能超过1000")
        private Integer maxUses;

        private Long teamId;
    }

    @Data
    @Schema(name = "InviteCreateResponse")
    public static class CreateResponse {
        private Long inviteId;
        private String code;
        private String type;
        private String sharePath;
        private Integer maxUses;
        private LocalDateTime expiresAt;
        private Integer remainingSlots;
    }

    @Data
    @Schema(name = "InviteResponse")
    public static class Response {
        private Long id;
        private String code;
        private String type;
        private String email;
        private Integer maxUses;
        private Integer useCount;
        private LocalDateTime expiresAt;
        private LocalDateTime createdAt;
    }

    @Data
    @Schema(name = "InviteValidation")
    public static class Validation {
        private boolean valid;
        private String type;
        private String restrictedEmail;
        private String inviterDisplayName;
        private Integer remainingUses;
        private String reason;
    }

    /**
     * 公司邀请注册后加入的组织位置
     */
    public record CompanyTarget(Long companyId, Long teamId) {
    }
}
