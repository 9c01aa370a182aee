package com.sunny.procurehub.platform.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/**
 * 令牌生成组件
 * 会话令牌、CSRF 令牌与邮箱验证令牌均由此生成
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Component
public class TokenGenerator {

    public static final int DEFAULT_TOKEN_BYTES = 32;

    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom secureRandom = new SecureRandom();

    public String randomToken() {
        return randomToken(DEFAULT_TOKEN_BYTES);
    }

    public String randomToken(int bytes) {
        if (bytes < 16) {
            throw new IllegalArgumentException("令牌长度不足");
        }
        byte[] buffer = new byte[bytes];
        secureRandom.nextBytes(buffer);
        return URL_ENCODER.encodeToString(buffer);
    }

    public static boolean constantTimeEquals(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        return MessageDigest.isEqual(
                left.getBytes(StandardCharsets.UTF_8),
                right.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 不可用", ex);
        }
    }
}
