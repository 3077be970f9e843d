package com.bit.hydro.exception;

/**
 * 账本层自定义异常：统一封装异常类型与错误信息，便于问题定位
 */
public class HydroException extends RuntimeException {

    // 异常类型（用于分类处理）
    private final ErrorType errorType;

    // 不带类型前缀的原始信息
    private final String detail;

    public HydroException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
        this.detail = message;
    }

    // 带cause异常（链式追踪）
    public HydroException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
        this.detail = message;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getDetail() {
        return detail;
    }

    public static HydroException validation(String message) {
        return new HydroException(ErrorType.VALIDATION, message);
    }

    public static HydroException notFound(String message) {
        return new HydroException(ErrorType.NOT_FOUND, message);
    }

    public static HydroException unauthorized(String message) {
        return new HydroException(ErrorType.UNAUTHORIZED, message);
    }

    public static HydroException arithmetic(String message) {
        return new HydroException(ErrorType.ARITHMETIC, message);
    }
}
