package com.sunny.procurehub.platform.module.user.service;

import com.sunny.procurehub.platform.module.user.entity.UserSession;
import com.sunny.procurehub.platform.security.AuthContext;
import java.util.Optional;

/**
 * 会话服务
 */
public interface SessionService {

    UserSession createSession(Long userId);

    /**
     * 会话存在且未过期时返回上下文
     */
    Optional<AuthContext> resolve(String token);

    AuthContext validateSession(String token);

    /**
     * 幂等，令牌不存在时同样成功
     */
    void destroySession(String token);

    int purgeExpired();
}
