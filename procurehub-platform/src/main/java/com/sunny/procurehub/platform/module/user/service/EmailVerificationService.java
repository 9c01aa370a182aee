package com.sunny.procurehub.platform.module.user.service;

/**
 * 邮箱验证服务
 */
public interface EmailVerificationService {

    /**
     * 签发新令牌并返回原文，库中只保存摘要
     */
    String issue(Long userId);

    void verify(String rawToken, String clientIp);
}
