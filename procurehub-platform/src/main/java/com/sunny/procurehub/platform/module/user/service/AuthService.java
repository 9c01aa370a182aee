package com.sunny.procurehub.platform.module.user.service;

import com.sunny.procurehub.platform.module.user.dto.AuthDto;
import com.sunny.procurehub.platform.security.AuthContext;

/**
 * 认证服务
 */
public interface AuthService {

    AuthDto.AuthResult register(AuthDto.Register dto, String clientIp, String visitorCookie);

    AuthDto.AuthResult login(AuthDto.Login dto, String clientIp, String visitorCookie);

    void logout(String sessionToken);

    AuthDto.SessionResult currentSession(AuthContext context, String visitorCookie, String csrfCookie);
}
