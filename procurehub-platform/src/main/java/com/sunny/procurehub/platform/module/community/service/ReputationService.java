package com.sunny.procurehub.platform.module.community.service;

import com.sunny.procurehub.platform.module.community.enums.ReputationReason;

/**
 * 声望服务
 * 声望变更与流水写入在同一事务中完成
 */
public interface ReputationService {

    /**
     * 返回实际请求的变化量
     */
    int apply(Long userId, ReputationReason reason, boolean reversal, String referenceType, Long referenceId);

    /**
     * 记录当日活跃，更新连续活跃天数
     */
    void recordActivity(Long userId);
}
