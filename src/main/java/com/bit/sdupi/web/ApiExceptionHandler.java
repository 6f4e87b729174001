package com.bit.sdupi.web;

import com.bit.sdupi.core.ErrorType;
import com.bit.sdupi.core.TokenException;
import com.bit.sdupi.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 请求参数错误（地址格式、金额格式、缺少参数）统一转换为 INVALID_OPERATION
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(TokenException.class)
    public Result<Void> handleTokenException(TokenException e) {
        return Result.error(e);
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public Result<Void> handleBadRequest(Exception e) {
        log.debug("请求参数错误: {}", e.getMessage());
        return Result.error(new TokenException(ErrorType.INVALID_OPERATION, e.getMessage(), e));
    }
}
