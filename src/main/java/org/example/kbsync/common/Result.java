package org.example.kbsync.common;


import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * 所有接口统一的响应包装：
 * {
 * "code": 200,
 * "message": "操作成功",
 * "data": { ... }
 * }
 * code 与 HTTP 状态码一致，local 同步客户端解析响应时会再校验一次。
 */
@Data
public class Result<T> {
    private int code;
    private String message;
    private T data;

    protected Result() {
    }

    private Result(ResultCode resultCode, String message, T data) {
        this.code = resultCode.getCode();
        this.message = message == null ? resultCode.getMessage() : message;
        this.data = data;
    }

    public static <T> Result<T> success(T data) {
        return new Result<>(ResultCode.SUCCESS, null, data);
    }

    public static <T> Result<T> success(T data, String message) {
        return new Result<>(ResultCode.SUCCESS, message, data);
    }

    public static <T> Result<T> failed(ResultCode resultCode) {
        return new Result<>(resultCode, null, null);
    }

    public static <T> Result<T> failed(ResultCode resultCode, String message) {
        return new Result<>(resultCode, message, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code == ResultCode.SUCCESS.getCode();
    }
}
