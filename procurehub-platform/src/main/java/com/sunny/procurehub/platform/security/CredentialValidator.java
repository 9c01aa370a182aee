package com.sunny.procurehub.platform.security;

import com.sunny.procurehub.platform.config.PlatformSecurityProperties;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 凭证格式校验组件
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Component
@RequiredArgsConstructor
public class CredentialValidator {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern NUMBER_OR_SPECIAL = Pattern.compile("[0-9]|[^A-Za-z0-9]");
    private static final int MAX_EMAIL_LENGTH = 320;

    private static final List<String> COMMON_PASSWORDS = List.of(
            "password", "password123", "12345678", "123456789", "qwerty123",
            "letmein", "welcome", "admin123", "iloveyou", "sunshine");

    private final PlatformSecurityProperties securityProperties;

    /**
     * 去除首尾空白并转小写
     */
    public static String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isValidEmail(String normalizedEmail) {
        return normalizedEmail != null
                && normalizedEmail.length() <= MAX_EMAIL_LENGTH
                && EMAIL_PATTERN.matcher(normalizedEmail).matches();
    }

    /**
     * 返回第一条不满足的规则说明，全部满足时返回 empty
     */
    public Optional<String> checkPassword(String password) {
        int minLength = securityProperties.getPassword().getMinLength();
        if (password == null || password.length() < minLength) {
            return Optional.of("密码长度至少为 " + minLength + " 位");
        }
        if (!NUMBER_OR_SPECIAL.matcher(password).find()) {
            return Optional.of("密码需包含至少一个数字或特殊字符");
        }
        String lowered = password.toLowerCase(Locale.ROOT);
        for (String common : COMMON_PASSWORDS) {
            if (lowered.equals(common) || lowered.contains(common)) {
                return Optional.of("密码过于常见，请更换");
            }
        }
        return Optional.empty();
    }

    /**
     * 日志中只输出脱敏邮箱
     */
    public static String maskEmail(String email) {
        if (email == null) {
            return "-";
        }
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
