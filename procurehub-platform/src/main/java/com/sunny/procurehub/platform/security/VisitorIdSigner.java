package com.sunny.procurehub.platform.security;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * 访客ID签名组件
 * 格式为 {keyVersion}.{base64url(payload)}.{base64url(hmac)}，校验时依次尝试所有已知版本
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Component
public class VisitorIdSigner {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder URL_DECODER = Base64.getUrlDecoder();

    private final Map<String, byte[]> keys;
    private final String currentKeyVersion;

    public VisitorIdSigner(PlatformSecurityProperties securityProperties) {
        PlatformSecurityProperties.Visitor visitor = securityProperties.getVisitor();
        Map<String, byte[]> loaded = new LinkedHashMap<>();
        visitor.getKeys().forEach((version, secret) -> {
            if (secret != null && !secret.isBlank()) {
                loaded.put(version, secret.getBytes(StandardCharsets.UTF_8));
            }
        });
        if (!loaded.containsKey(visitor.getCurrentKeyVersion())) {
            throw new IllegalStateException("访客签名密钥未配置: " + visitor.getCurrentKeyVersion());
        }
        this.keys = Map.copyOf(loaded);
        this.currentKeyVersion = visitor.getCurrentKeyVersion();
    }

    /**
     * 生成未签名的访客ID，写 Cookie 前由 sign 签一次
     */
    public String mint() {
        return UUID.randomUUID().toString();
    }

    public String sign(String visitorId) {
        String payload = URL_ENCODER.encodeToString(visitorId.getBytes(StandardCharsets.UTF_8));
        String signature = URL_ENCODER.encodeToString(hmac(keys.get(currentKeyVersion), payload));
        return currentKeyVersion + "." + payload + "." + signature;
    }

    /**
     * 校验签名并返回访客ID；两段式旧格式没有版本前缀，尝试全部密钥
     */
    public Optional<String> verify(String signedBlob) {
        if (signedBlob == null || signedBlob.isBlank()) {
            return Optional.empty();
        }
        String[] parts = signedBlob.split("\\.", -1);
        if (parts.length == 3) {
            byte[] key = keys.get(parts[0]);
            if (key == null) {
                return Optional.empty();
            }
            return verifyWithKey(key, parts[1], parts[2]);
        }
        if (parts.length == 2) {
            for (byte[] key : keys.values()) {
                Optional<String> visitorId = verifyWithKey(key, parts[0], parts[1]);
                if (visitorId.isPresent()) {
                    return visitorId;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> verifyWithKey(byte[] key, String payload, String signature) {
        byte[] provided;
        byte[] decodedPayload;
        try {
            provided = URL_DECODER.decode(signature);
            decodedPayload = URL_DECODER.decode(payload);
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
        if (!MessageDigest.isEqual(hmac(key, payload), provided)) {
            return Optional.empty();
        }
        String visitorId = new String(decodedPayload, StandardCharsets.UTF_8);
        return isUuid(visitorId) ? Optional.of(visitorId) : Optional.empty();
    }

    private boolean isUuid(String value) {
        try {
            UUID.fromString(value);
            return value.length() == 36;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    private byte[] hmac(byte[] key, String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("访客签名失败", ex);
        }
    }
}
