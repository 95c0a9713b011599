package org.example.kbsync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * cloud/local 同步相关配置，进程启动时读取一次
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "kb.sync")
public class SyncProperties {

    private boolean enabled = false;

    /**
     * 配对的 cloud 实例地址，仅 local 实例使用
     */
    private String cloudUrl;

    /**
     * 机器间共享密钥，通过 X-Sync-API-Key 请求头传递
     */
    private String apiKey;

    private int maxAttempts = 3;

    private Duration claimLeaseTimeout = Duration.ofMinutes(30);

    private int pageSize = 50;

    private int pullPageSize = 100;

    /**
     * 拉取只返回 updatedAt 不晚于 now - pullCommitLag 的变更，须大于最长的写事务耗时
     */
    private Duration pullCommitLag = Duration.ofMinutes(5);

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofMinutes(2);

    private Worker worker = new Worker();

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Data
    public static class Worker {
        private Duration interval = Duration.ofMinutes(30);
        // 调度器检查是否到期的频率，远小于 interval
        private Duration tick = Duration.ofSeconds(30);
        private boolean batchPush = false;
    }
}
