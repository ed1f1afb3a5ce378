package com.cinetix.common.exception;

import com.cinetix.common.response.ErrorCode;
import lombok.Getter;

/**
 * Domain failure carrying an {@link ErrorCode}. Every rejected operation surfaces as one of these.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
