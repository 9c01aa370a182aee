package com.sunny.procurehub.platform.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 审批流配置属性
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "approval")
public class ApprovalProperties {

    private Sweep sweep = new Sweep();

    /**
     * 手动升级或规则未配置时使用的审批时限
     */
    private int defaultEscalationHours = 24;

    @Data
    public static class Sweep {
        private boolean enabled = true;
        private Duration fixedDelay = Duration.ofMinutes(5);
        private int batchSize = 100;
    }
}
