package com.sunny.procurehub.common.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sunny.procurehub.common.exception.ExceptionMapper.ExceptionDetail;
import java.util.Map;

/**
 * 统一错误响应
 *
 * @author Sunny
 * @date 2026-01-01
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private int code;
    private String type;
    private String message;
    private Map<String, String> context;
    private String traceId;
    private Boolean retryable;

    public ErrorResponse() {
    }

    public static ErrorResponse from(ExceptionDetail detail) {
        ErrorResponse response = new ErrorResponse();
        response.code = detail.httpStatus();
        response.type = detail.type();
        response.message = detail.message();
        response.context = detail.context() == null || detail.context().isEmpty() ? null : detail.context();
        response.traceId = detail.traceId();
        response.retryable = detail.retryable() ? Boolean.TRUE : null;
        return response;
    }

    public int getCode() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Map<String, String> getContext() {
        return context;
    }

    public void setContext(Map<String, String> context) {
        this.context = context;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public Boolean getRetryable() {
        return retryable;
    }

    public void setRetryable(Boolean retryable) {
        this.retryable = retryable;
    }
}
