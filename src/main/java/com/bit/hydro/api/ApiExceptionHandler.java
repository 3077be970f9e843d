package com.bit.hydro.api;

import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.bit.hydro.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 账本异常统一转成 Result，交易已在 HydroLedger 中回滚
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(HydroException.class)
    public Result<Void> handleHydroException(HydroException e) {
        if (e.getErrorType() == ErrorType.UNAUTHORIZED) {
            return Result.noauth(e.getMessage());
        }
        if (e.getErrorType() == ErrorType.STORAGE) {
            log.error("存储异常", e);
        }
        return Result.error(e.getMessage());
    }
}
