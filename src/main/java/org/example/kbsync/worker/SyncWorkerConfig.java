package org.example.kbsync.worker;

import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.config.SyncProperties;
import org.example.kbsync.config.SyncApiKeyFilter;
import org.example.kbsync.extraction.ExtractionPipeline;
import org.example.kbsync.service.PulledChangeApplier;
import org.example.kbsync.service.SyncAuditService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * 只在启用同步的 local 实例上装配 worker
 */
@Slf4j
@Configuration
@ConditionalOnExpression("${kb.sync.enabled:false} and '${kb.deployment.tier:cloud}'.equalsIgnoreCase('local')")
public class SyncWorkerConfig {

    @Bean
    public RestTemplate syncRestTemplate(RestTemplateBuilder builder, SyncProperties syncProperties) {
        if (syncProperties.getCloudUrl() == null || syncProperties.getCloudUrl().isBlank()) {
            throw new IllegalStateException("已启用同步但未配置 kb.sync.cloud-url");
        }
        if (!syncProperties.hasApiKey()) {
            throw new IllegalStateException("已启用同步但未配置 kb.sync.api-key");
        }
        log.info("同步客户端指向 {}", syncProperties.getCloudUrl());
        return builder
                .rootUri(syncProperties.getCloudUrl())
                .setConnectTimeout(syncProperties.getConnectTimeout())
                .setReadTimeout(syncProperties.getReadTimeout())
                .defaultHeader(SyncApiKeyFilter.API_KEY_HEADER, syncProperties.getApiKey())
                .build();
    }

    @Bean
    public SyncClient syncClient(RestTemplate syncRestTemplate) {
        return new RestSyncClient(syncRestTemplate);
    }

    @Bean
    public SyncWorker syncWorker(SyncClient syncClient,
                                 ExtractionPipeline extractionPipeline,
                                 PulledChangeApplier pulledChangeApplier,
                                 SyncAuditService syncAuditService,
                                 SyncProperties syncProperties,
                                 Clock clock) {
        return new SyncWorker(syncClient, extractionPipeline, pulledChangeApplier, syncAuditService, syncProperties, clock);
    }

    @Bean
    public SyncWorkerScheduler syncWorkerScheduler(SyncWorker syncWorker, TaskScheduler syncTaskScheduler,
                                                   SyncProperties syncProperties, Clock clock) {
        return new SyncWorkerScheduler(syncWorker, syncTaskScheduler, syncProperties.getWorker().getTick(), clock);
    }
}
