package com.sunny.procurehub.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * 密码Encoder配置
 * 按 security.password.argon2 装配 Argon2 编码器
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Configuration
public class PasswordEncoderConfig {

    @Bean
    public PasswordEncoder passwordEncoder(PlatformSecurityProperties securityProperties) {
        PlatformSecurityProperties.Password.Argon2 argon2 = securityProperties.getPassword().getArgon2();
        return new Argon2PasswordEncoder(
                argon2.getSaltLength(),
                argon2.getHashLength(),
                argon2.getParallelism(),
                argon2.getMemoryMb() * 1024,
                argon2.getIterations());
    }
}
