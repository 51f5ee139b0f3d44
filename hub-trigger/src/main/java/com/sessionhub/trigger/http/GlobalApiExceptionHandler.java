package com.sessionhub.trigger.http;

import com.sessionhub.api.response.Response;
import com.sessionhub.types.enums.ResponseCode;
import com.sessionhub.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理。
 * <p>
 * 业务异常按 {@link ResponseCode} 映射；会话不存在同时返回 HTTP 404，其余保持 200 + 错误码。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex,
                                               HttpServletRequest request,
                                               HttpServletResponse response) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        if (ResponseCode.SESSION_NOT_FOUND.getCode().equals(code) && response != null) {
            response.setStatus(HttpStatus.NOT_FOUND.value());
        }
        log.warn(errorLine(request, ex, code, info));
        return Response.failure(code, info);
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            HttpRequestMethodNotSupportedException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        log.warn(errorLine(request, ex, ResponseCode.ILLEGAL_PARAMETER.getCode(), info));
        return Response.failure(ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error(errorLine(request, ex, ResponseCode.UN_ERROR.getCode(), truncate(ex.getMessage())), ex);
        return Response.failure(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
    }

    private String errorLine(HttpServletRequest request, Exception ex, String code, String info) {
        return "HTTP_ERROR path=" + (request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-"))
                + ", method=" + (request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-"))
                + ", traceId=" + StringUtils.defaultIfBlank(MDC.get("traceId"), "-")
                + ", requestId=" + StringUtils.defaultIfBlank(MDC.get("requestId"), "-")
                + ", errorType=" + ex.getClass().getSimpleName()
                + ", errorCode=" + code
                + ", errorMessage=" + info;
    }

    private String truncate(String text) {
        if (StringUtils.isBlank(text) || text.length() <= MAX_INFO_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_INFO_LENGTH);
    }
}
