package com.sunny.procurehub.platform.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 平台安全配置属性
 * 承载 Cookie、会话、访客签名、限流与计时下限配置
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "security")
public class PlatformSecurityProperties {

    private Cookie cookie = new Cookie();
    private Session session = new Session();
    private Csrf csrf = new Csrf();
    private Visitor visitor = new Visitor();
    private Timing timing = new Timing();
    private RateLimit rateLimit = new RateLimit();
    private Invite invite = new Invite();
    private Verification verification = new Verification();
    private Password password = new Password();
    private List<String> trustedProxies = new ArrayList<>();

    @Data
    public static class Cookie {
        /**
         * 默认开启 Secure 标记，仅 dev 配置关闭
         */
        private boolean secure = true;
        private String sessionName = "ph_session";
        private String csrfName = "ph_csrf";
        private String visitorName = "ph_visitor";
        private String sameSite = "Lax";
    }

    @Data
    public static class Session {
        private Duration ttl = Duration.ofDays(30);
        private boolean purgeEnabled = true;
    }

    @Data
    public static class Csrf {
        private String headerName = "X-CSRF-Token";
    }

    @Data
    public static class Visitor {
        private Duration ttl = Duration.ofDays(365);
        private String currentKeyVersion = "v1";
        /**
         * 版本号到签名密钥的映射，轮换时新增版本并保留旧版本一段时间
         */
        private Map<String, String> keys = new LinkedHashMap<>();
    }

    @Data
    public static class Timing {
        private Duration floor = Duration.ofMillis(300);
    }

    @Data
    public static class RateLimit {
        /**
         * memory | redis
         */
        private String store = "memory";
        private Map<String, Rule> routes = new LinkedHashMap<>();
    }

    @Data
    public static class Rule {
        private int limit;
        private Duration window;
    }

    @Data
    public static class Invite {
        private Duration expiry = Duration.ofDays(7);
        private int linkMaxUses = 5;
        private int adminQuota = 50;
    }

    @Data
    public static class Verification {
        private Duration ttl = Duration.ofHours(24);
    }

    @Data
    public static class Password {
        private int minLength = 8;
        private Argon2 argon2 = new Argon2();

        @Data
        public static class Argon2 {
            private int saltLength = 16;
            private int hashLength = 32;
            private int parallelism = 1;
            /**
             * 内存成本（MB）
             */
            private int memoryMb = 64;
            private int iterations = 3;
        }
    }
}
