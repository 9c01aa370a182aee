package com.sunny.procurehub.platform.module.user.dto;

import com.sunny.procurehub.platform.module.permission.PermissionSet;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.LocalDateTime;
import lombok.Data;
import lombok.ToString;

/**
 * 认证 DTO
 */
public class AuthDto {

    @Data
    @Schema(name = "RegisterRequest")
    public static class Register {
        @NotBlank(message = "邮箱不能为空")
        @Size(max = 320, message = "邮箱长度不能超过320个字符")
        private String email;

        @ToString.Exclude
        @NotBlank(message = "密码不能为空")
        @Size(max = 128, message = "密码长度不能超过128个字符")
        private String password;

        @NotBlank(message = "邀请码不能为空")
        @Size(max = 32, message = "邀请码格式不正确")
        private String inviteCode;

        @Size(max = 100, message = "昵称长度不能超过100个字符")
        private String displayName;
    }

    @Data
    @Schema(name = "LoginRequest")
    public static class Login {
        @NotBlank(message = "邮箱不能为空")
        private String email;

        @ToString.Exclude
        @NotBlank(message = "密码不能为空")
        private String password;
    }

    @Data
    @Schema(name = "VerifyEmailRequest")
    public static class VerifyEmail {
        @ToString.Exclude
        @NotBlank(message = "验证令牌不能为空")
        private String token;
    }

    @Data
    @Schema(name = "AuthUser")
    public static class UserView {
        private Long id;
        private String email;
        private boolean emailVerified;
        private LocalDateTime createdAt;
    }

    @Data
    @Schema(name = "AuthProfile")
    public static class ProfileView {
        private String displayName;
        private Integer reputation;
        private Integer inviteSlots;
        private Integer currentStreak;
        private Integer longestStreak;
        private String onboardingStep;
    }

    /**
     * 注册与登录结果；令牌只用于写 Cookie，不进入响应体以外的日志
     */
    @Data
    public static class AuthResult {
        @ToString.Exclude
        private String sessionToken;
        @ToString.Exclude
        private String csrfToken;
        @ToString.Exclude
        private String signedVisitorId;
        private UserView user;
        private ProfileView profile;
    }

    @Data
    @Schema(name = "AuthResponse")
    public static class AuthResponse {
        private UserView user;
        private ProfileView profile;
        private String csrfToken;
    }

    @Data
    @Schema(name = "SessionView")
    public static class SessionView {
        private boolean authenticated;
        private UserView user;
        private ProfileView profile;
        private PermissionSet permissions;
        private String status;
        private String visitorId;
        private String csrfToken;
        private Long companyId;
        private String role;
    }

    /**
     * 会话查询结果；signedVisitorId 与 csrfToken 仅在需要重新下发 Cookie 时非空
     */
    @Data
    public static class SessionResult {
        private SessionView view;
        @ToString.Exclude
        private String signedVisitorId;
        @ToString.Exclude
        private String csrfToken;
    }
}
