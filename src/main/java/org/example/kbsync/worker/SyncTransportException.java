package org.example.kbsync.worker;

/**
 * 网络错误、超时或 cloud 暂时不可用，下个周期可重试
 */
public class SyncTransportException extends SyncClientException {

    public SyncTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
