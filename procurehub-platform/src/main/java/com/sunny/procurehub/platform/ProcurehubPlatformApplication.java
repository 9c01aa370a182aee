package com.sunny.procurehub.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ProcureHub 平台启动类
 * 承载身份会话、邀请、积分账本与审批核心
 *
 * @author Sunny
 * @date 2026-03-02
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class ProcurehubPlatformApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProcurehubPlatformApplication.class, args);
    }
}
