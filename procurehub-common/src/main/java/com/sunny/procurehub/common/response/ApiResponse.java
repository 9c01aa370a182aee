package com.sunny.procurehub.common.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 统一成功响应
 * 分页接口额外携带 limit、offset 与 total
 *
 * @author Sunny
 * @date 2026-01-01
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private static final int OK = 0;

    private int code;
    private T data;
    private Integer limit;
    private Integer offset;
    private Long total;

    public ApiResponse() {
    }

    private ApiResponse(T data, Integer limit, Integer offset, Long total) {
        this.code = OK;
        this.data = data;
        this.limit = limit;
        this.offset = offset;
        this.total = total;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(data, null, null, null);
    }

    public static ApiResponse<Void> ok() {
        return new ApiResponse<>(null, null, null, null);
    }

    public static <T> ApiResponse<T> page(T data, int limit, int offset, long total) {
        return new ApiResponse<>(data, limit, offset, total);
    }

    public int getCode() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    public T getData() {
        return data;
    }

    public void setData(T data) {
        this.data = data;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public void setOffset(Integer offset) {
        this.offset = offset;
    }

    public Long getTotal() {
        return total;
    }

    public void setTotal(Long total) {
        this.total = total;
    }
}
