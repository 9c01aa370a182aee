package com.sunny.procurehub.platform.module.user.service;

/**
 * 访客认领服务
 */
public interface VisitorService {

    /**
     * 每个访客ID只能被认领一次，重复认领静默忽略并返回 false
     */
    boolean claimVisitor(String visitorId, Long userId);
}
