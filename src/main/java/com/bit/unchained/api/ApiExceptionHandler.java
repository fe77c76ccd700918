package com.bit.unchained.api;

import com.bit.unchained.api.dto.ErrorDetail;
import com.bit.unchained.error.StakingException;
import com.bit.unchained.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 统一异常处理：业务错误转为 Result.error，携带错误名、行下标与nonce
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(StakingException.class)
    public Result<ErrorDetail> handleStaking(StakingException ex) {
        log.warn("请求被拒绝: {}", ex.getMessage());
        ErrorDetail detail = new ErrorDetail(ex.getErrorType().name(), ex.getIndex(), ex.getNonce());
        return Result.error(ex.getErrorType().getCode(), ex.getMessage(), detail);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public Result<ErrorDetail> handleBadRequest(Exception ex) {
        log.warn("请求参数错误: {}", ex.getMessage());
        return Result.error(400, "请求参数错误: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Result<ErrorDetail> handleUnexpected(Exception ex) {
        log.error("请求处理失败", ex);
        return Result.error(Result.SC_INTERNAL_SERVER_ERROR_500, "系统异常: " + ex.getMessage());
    }
}
