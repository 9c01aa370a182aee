package com.sunny.procurehub.platform.module.user.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 过期会话清理任务
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "security.session", name = "purge-enabled", havingValue = "true", matchIfMissing = true)
public class SessionPurgeScheduler {

    private final SessionService sessionService;

    @Scheduled(fixedDelayString = "${security.session.purge-interval:PT1H}", initialDelayString = "PT5M")
    public void purge() {
        try {
            sessionService.purgeExpired();
        } catch (RuntimeException ex) {
            log.error("security_event event=session_purge_failed", ex);
        }
    }
}
