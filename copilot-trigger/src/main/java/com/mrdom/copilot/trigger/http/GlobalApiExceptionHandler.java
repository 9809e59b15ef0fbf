package com.mrdom.copilot.trigger.http;

import com.mrdom.copilot.api.response.Response;
import com.mrdom.copilot.types.common.Constants;
import com.mrdom.copilot.types.enums.ResponseCode;
import com.mrdom.copilot.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * 统一 API 异常处理。
 * <p>
 * AppException 按异常码映射 HTTP 状态：非法标识 400，记录不存在 404，模型不可用 503，超时 504。
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    private static final Map<String, HttpStatus> STATUS_BY_CODE = Map.of(
            ResponseCode.ILLEGAL_PARAMETER.getCode(), HttpStatus.BAD_REQUEST,
            ResponseCode.INVALID_IDENTIFIER.getCode(), HttpStatus.BAD_REQUEST,
            ResponseCode.NOT_FOUND.getCode(), HttpStatus.NOT_FOUND,
            ResponseCode.PROVIDER_ERROR.getCode(), HttpStatus.SERVICE_UNAVAILABLE,
            ResponseCode.REQUEST_TIMEOUT.getCode(), HttpStatus.GATEWAY_TIMEOUT);

    @ExceptionHandler(AppException.class)
    public ResponseEntity<Response<Object>> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        logWarn(request, ex, code, info);
        return ResponseEntity.status(STATUS_BY_CODE.getOrDefault(code, HttpStatus.INTERNAL_SERVER_ERROR))
                .body(body(code, info));
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Response<Object>> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        logWarn(request, ex, ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
        return ResponseEntity.badRequest().body(body(ResponseCode.ILLEGAL_PARAMETER.getCode(), info));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response<Object>> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, userId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                mdc(Constants.MdcKeys.TRACE_ID),
                mdc(Constants.MdcKeys.USER_ID),
                ex.getClass().getSimpleName(),
                ResponseCode.UN_ERROR.getCode(),
                truncate(ex.getMessage()),
                ex);
        return ResponseEntity.internalServerError()
                .body(body(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo()));
    }

    private void logWarn(HttpServletRequest request, Exception ex, String code, String info) {
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, userId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                mdc(Constants.MdcKeys.TRACE_ID),
                mdc(Constants.MdcKeys.USER_ID),
                ex.getClass().getSimpleName(),
                code,
                info);
    }

    private Response<Object> body(String code, String info) {
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String mdc(String key) {
        return StringUtils.defaultIfBlank(MDC.get(key), "-");
    }

    private String truncate(String text) {
        return StringUtils.abbreviate(text, MAX_INFO_LENGTH);
    }
}
