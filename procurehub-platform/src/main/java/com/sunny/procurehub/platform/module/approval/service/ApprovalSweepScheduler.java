package com.sunny.procurehub.platform.module.approval.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 审批超时扫描任务
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "approval.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ApprovalSweepScheduler {

    private final ApprovalService approvalService;

    @Scheduled(fixedDelayString = "${approval.sweep.fixed-delay:PT5M}", initialDelayString = "PT1M")
    public void sweep() {
        try {
            approvalService.sweepOverdue();
        } catch (RuntimeException ex) {
            log.error("approval_event event=sweep_aborted", ex);
        }
    }
}
