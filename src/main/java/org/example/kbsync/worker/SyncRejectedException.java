package org.example.kbsync.worker;

import lombok.Getter;

/**
 * cloud 明确拒绝了请求（4xx）
 */
@Getter
public class SyncRejectedException extends SyncClientException {

    private final int status;

    public SyncRejectedException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public boolean isConflict() {
        return status == 409;
    }

    /**
     * 同步密钥缺失或无效，换一个文档或等下一轮都不会改变结果
     */
    public boolean isAuthFailure() {
        return status == 401 || status == 403;
    }
}
