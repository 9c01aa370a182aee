package com.sunny.procurehub.platform.module.user.controller;

import com.sunny.procurehub.common.response.ApiResponse;
import com.sunny.procurehub.platform.module.user.dto.AuthDto;
import com.sunny.procurehub.platform.module.user.service.AuthService;
import com.sunny.procurehub.platform.module.user.service.EmailVerificationService;
import com.sunny.procurehub.platform.security.AuthContext;
import com.sunny.procurehub.platform.security.ClientIpResolver;
import com.sunny.procurehub.platform.security.PlatformCookieManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 认证控制器
 * 负责注册、登录、登出、会话查询与邮箱验证接口
 *
 * @author Sunny
 * @date 2026-03-02
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "认证", description = "注册、登录与会话接口")
public class AuthController {

    private final AuthService authService;
    private final EmailVerificationService emailVerificationService;
    private final PlatformCookieManager cookieManager;
    private final ClientIpResolver clientIpResolver;

    @Operation(summary = "邀请码注册")
    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<AuthDto.AuthResponse> register(@Valid @RequestBody AuthDto.Register dto,
                                                      HttpServletRequest request,
                                                      HttpServletResponse response) {
        AuthDto.AuthResult result = authService.register(dto, clientIpResolver.resolve(request),
                cookieManager.readVisitorCookie(request));
        return ApiResponse.ok(writeCookies(result, response));
    }

    @Operation(summary = "邮箱密码登录")
    @PostMapping("/login")
    public ApiResponse<AuthDto.AuthResponse> login(@Valid @RequestBody AuthDto.Login dto,
                                                   HttpServletRequest request,
                                                   HttpServletResponse response) {
        AuthDto.AuthResult result = authService.login(dto, clientIpResolver.resolve(request),
                cookieManager.readVisitorCookie(request));
        return ApiResponse.ok(writeCookies(result, response));
    }

    /**
     * 登出不校验 CSRF，令牌不存在时同样返回成功
     */
    @Operation(summary = "退出登录")
    @PostMapping("/logout")
    public ApiResponse<Void> logout(HttpServletRequest request, HttpServletResponse response) {
        authService.logout(cookieManager.readSessionToken(request));
        cookieManager.clearSessionCookies(response);
        return ApiResponse.ok();
    }

    @Operation(summary = "当前会话")
    @GetMapping("/session")
    public ApiResponse<AuthDto.SessionView> session(HttpServletRequest request, HttpServletResponse response) {
        AuthDto.SessionResult result = authService.currentSession(AuthContext.current(request),
                cookieManager.readVisitorCookie(request), cookieManager.readCsrfToken(request));
        if (result.getSignedVisitorId() != null) {
            cookieManager.setVisitorCookie(response, result.getSignedVisitorId());
        }
        if (result.getCsrfToken() != null) {
            cookieManager.setCsrfCookie(response, result.getCsrfToken());
        }
        return ApiResponse.ok(result.getView());
    }

    @Operation(summary = "验证邮箱")
    @PostMapping("/verify-email")
    public ApiResponse<Void> verifyEmail(@Valid @RequestBody AuthDto.VerifyEmail dto, HttpServletRequest request) {
        emailVerificationService.verify(dto.getToken(), clientIpResolver.resolve(request));
        return ApiResponse.ok();
    }

    private AuthDto.AuthResponse writeCookies(AuthDto.AuthResult result, HttpServletResponse response) {
        cookieManager.setSessionCookies(response, result.getSessionToken(), result.getCsrfToken());
        cookieManager.setVisitorCookie(response, result.getSignedVisitorId());

        AuthDto.AuthResponse body = new AuthDto.AuthResponse();
        body.setUser(result.getUser());
        body.setProfile(result.getProfile());
        body.setCsrfToken(result.getCsrfToken());
        return body;
    }
}
