package com.sunny.procurehub.platform.module.invite.enums;

/**
 * 邀请消费结果
 *
 * @author Sunny
 * @date 2026-03-02
 */
public enum ConsumeOutcome {
    SUCCESS,
    LOST_RACE
}
