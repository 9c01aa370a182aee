package com.sunny.procurehub.platform.handler;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.BadRequestException;
import com.sunny.procurehub.common.exception.ExceptionMapper;
import com.sunny.procurehub.common.exception.ProcurehubRuntimeException;
import com.sunny.procurehub.common.response.ErrorResponse;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 平台Controller异常处理器
 * 负责把异常统一输出为 ErrorResponse 并设置 HTTP 状态码
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@RestControllerAdvice
public class PlatformControllerExceptionHandler {

    @ExceptionHandler(ProcurehubRuntimeException.class)
    public ErrorResponse handleProcurehubRuntimeException(ProcurehubRuntimeException exception,
                                                          HttpServletResponse response) {
        return buildErrorResponse(exception, response);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
    public ErrorResponse handleValidationException(BindException exception, HttpServletResponse response) {
        Map<String, String> errors = new LinkedHashMap<>();
        exception.getBindingResult().getAllErrors()
                .forEach(error -> errors.putIfAbsent(resolveErrorKey(error), error.getDefaultMessage()));

        String message = errors.isEmpty() ? "参数验证失败" : errors.toString();
        return buildErrorResponse(new BadRequestException(exception, ErrorType.INVALID_INPUT, errors, message), response);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ErrorResponse handleMalformedRequest(Exception exception, HttpServletResponse response) {
        return buildErrorResponse(new BadRequestException(exception, ErrorType.INVALID_INPUT, Map.of(), "请求格式错误"),
                response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ErrorResponse handleIllegalArgumentException(IllegalArgumentException exception,
                                                        HttpServletResponse response) {
        String message = exception.getMessage() == null ? "参数错误" : exception.getMessage();
        return buildErrorResponse(new BadRequestException(exception, ErrorType.INVALID_INPUT, Map.of(), message),
                response);
    }

    @ExceptionHandler(Exception.class)
    public ErrorResponse handleException(Exception exception, HttpServletResponse response) {
        return buildErrorResponse(exception, response);
    }

    private String resolveErrorKey(ObjectError error) {
        if (error instanceof FieldError fieldError) {
            return fieldError.getField();
        }
        return error.getObjectName();
    }

    private ErrorResponse buildErrorResponse(Throwable throwable, HttpServletResponse response) {
        ExceptionMapper.ExceptionDetail detail = ExceptionMapper.resolve(throwable);
        if (detail.serverError()) {
            log.error("服务异常: type={}, message={}", detail.type(), detail.message(), throwable);
        } else {
            log.warn("请求异常: type={}, message={}", detail.type(), detail.message());
        }

        response.setStatus(detail.httpStatus());
        return ErrorResponse.from(detail);
    }
}
