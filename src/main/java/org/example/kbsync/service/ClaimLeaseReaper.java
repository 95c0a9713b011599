package org.example.kbsync.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * cloud 侧定时释放租约超时的认领，保证 local 实例中途退出时文档不会卡在 processing
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "kb.deployment.tier", havingValue = "cloud", matchIfMissing = true)
public class ClaimLeaseReaper {

    private final SyncService syncService;

    @Scheduled(fixedDelayString = "${kb.sync.reaper-interval-ms:60000}",
            initialDelayString = "${kb.sync.reaper-interval-ms:60000}")
    public void reap() {
        int released = syncService.reapExpiredClaims();
        log.debug("租约检查完成，释放 {} 个", released);
    }
}
