package com.sunny.procurehub.common.exception;

import com.sunny.procurehub.common.constant.Code;
import com.sunny.procurehub.common.constant.ErrorType;
import java.util.Map;
import org.slf4j.MDC;

/**
 * 异常映射器
 * 将任意异常归一为响应所需的错误明细
 *
 * @author Sunny
 * @date 2026-01-01
 */
public final class ExceptionMapper {

    private static final String DEFAULT_INTERNAL_MESSAGE = "服务器内部错误";

    private ExceptionMapper() {
    }

    public static ExceptionDetail resolve(Throwable throwable) {
        Throwable target = throwable == null ? new InternalException(DEFAULT_INTERNAL_MESSAGE) : throwable;
        String traceId = resolveTraceId();

        if (target instanceof ProcurehubRuntimeException runtimeException) {
            return new ExceptionDetail(
                    runtimeException.getCode(),
                    runtimeException.getType(),
                    resolveMessage(runtimeException),
                    runtimeException.getContext(),
                    traceId,
                    runtimeException.isRetryable(),
                    runtimeException.getCode() >= Code.INTERNAL_ERROR);
        }
        if (target instanceof IllegalArgumentException) {
            return new ExceptionDetail(
                    Code.BAD_REQUEST,
                    ErrorType.BAD_REQUEST,
                    resolveMessage(target),
                    Map.of(),
                    traceId,
                    false,
                    false);
        }
        if (target instanceof UnsupportedOperationException) {
            return new ExceptionDetail(
                    Code.METHOD_NOT_ALLOWED,
                    ErrorType.METHOD_NOT_ALLOWED,
                    resolveMessage(target),
                    Map.of(),
                    traceId,
                    false,
                    false);
        }
        // 未知异常不向调用方暴露原始信息
        return new ExceptionDetail(
                Code.INTERNAL_ERROR,
                ErrorType.INTERNAL_ERROR,
                DEFAULT_INTERNAL_MESSAGE,
                Map.of(),
                traceId,
                false,
                true);
    }

    private static String resolveMessage(Throwable throwable) {
        String message = throwable.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        return DEFAULT_INTERNAL_MESSAGE;
    }

    private static String resolveTraceId() {
        String traceId = MDC.get("traceId");
        if (traceId != null && !traceId.isBlank()) {
            return traceId;
        }
        return null;
    }

    public record ExceptionDetail(
            int httpStatus,
            String type,
            String message,
            Map<String, String> context,
            String traceId,
            boolean retryable,
            boolean serverError) {
    }
}
