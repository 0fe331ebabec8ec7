package com.gotable.common.exception;

import lombok.Getter;

/**
 * {@link ErrorCode}를 담는 비즈니스 예외.
 * HTTP 상태는 코드가 결정하고, detail 메시지가 있으면 기본 메시지 대신 사용된다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail, Throwable cause) {
        super(detail, cause);
        this.errorCode = errorCode;
    }
}
