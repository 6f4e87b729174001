package com.bit.sdupi.core;

/**
 * 代币核心异常：每种前置条件失败对应唯一的 ErrorType，调用方按类型断言失败原因
 */
public class TokenException extends RuntimeException {

    private final ErrorType errorType;

    public TokenException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    public TokenException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
