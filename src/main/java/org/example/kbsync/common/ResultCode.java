package org.example.kbsync.common;


import lombok.Getter;

/**
 * code 同时作为 HTTP 状态码返回，同步客户端据此区分可重试与不可重试的错误
 */
@Getter
public enum ResultCode {

    SUCCESS(200, "操作成功"),
    FAILED(500, "操作失败"),
    VALIDATE_FAILED(400, "参数检验失败"),
    UNAUTHORIZED(401, "缺少同步密钥"),
    FORBIDDEN(403, "同步密钥无效"),
    NOT_FOUND(404, "资源不存在"),
    CONFLICT(409, "状态冲突"),
    PAYLOAD_TOO_LARGE(413, "文件过大"),
    SERVICE_UNAVAILABLE(503, "同步未配置");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }
}
