package org.example.kbsync.worker;

/**
 * 调用 cloud 同步接口失败
 */
public abstract class SyncClientException extends RuntimeException {

    protected SyncClientException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 按 HTTP 状态码归类：5xx、408、429 可重试，其余 4xx 为对方明确拒绝
     */
    public static SyncClientException fromStatus(int status, String message, Throwable cause) {
        if (status >= 500 || status == 408 || status == 429) {
            return new SyncTransportException("cloud 返回 " + status + ": " + message, cause);
        }
        return new SyncRejectedException(status, message, cause);
    }
}
