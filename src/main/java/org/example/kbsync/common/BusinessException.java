package org.example.kbsync.common;

import lombok.Getter;

import java.util.Optional;

/**
 * 业务异常，携带返回码，由 {@link GlobalExceptionHandler} 统一转换
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ResultCode resultCode;

    public BusinessException(ResultCode resultCode) {
        this(resultCode, null);
    }

    public BusinessException(ResultCode resultCode, String message) {
        super(Optional.ofNullable(message).orElse(resultCode.getMessage()));
        this.resultCode = resultCode;
    }

    public static BusinessException notFound(String what, Object id) {
        return new BusinessException(ResultCode.NOT_FOUND, what + "不存在: " + id);
    }

    public static BusinessException conflict(String message) {
        return new BusinessException(ResultCode.CONFLICT, message);
    }
}
