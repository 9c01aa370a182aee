package com.sunny.procurehub.platform.module.permission;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 认证状态
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Getter
public enum AuthStatus {

    ANONYMOUS("anonymous"),
    AUTHENTICATED("authenticated"),
    VERIFIED("verified");

    @JsonValue
    private final String code;

    AuthStatus(String code) {
        this.code = code;
    }
}
