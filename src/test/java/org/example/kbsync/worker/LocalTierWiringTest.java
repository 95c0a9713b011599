package org.example.kbsync.worker;

import org.example.kbsync.service.ClaimLeaseReaper;
import org.example.kbsync.service.DocumentEventPublisher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:kbsync_local;MODE=PostgreSQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH",
        "kb.deployment.tier=local",
        "kb.deployment.ocr-enabled=false",
        "kb.sync.enabled=true",
        "kb.sync.cloud-url=http://127.0.0.1:9",
        "kb.sync.worker.interval=45m",
        "kb.sync.worker.tick=1h"
})
@ActiveProfiles("test")
class LocalTierWiringTest {

    @Autowired
    private ApplicationContext context;
    @Autowired
    private SyncWorker syncWorker;

    @MockBean
    private DocumentEventPublisher documentEventPublisher;

    @Test
    void localTierWiresWorkerWithRestClient() {
        assertThat(context.getBean(SyncClient.class)).isInstanceOf(RestSyncClient.class);
        assertThat(context.getBeanNamesForType(ClaimLeaseReaper.class)).isEmpty();
        assertThat(syncWorker.getInterval()).isEqualTo(Duration.ofMinutes(45));
    }

    @Test
    void unreachableCloudIsReportedAsTransientError() {
        SyncWorker.CycleReport report = syncWorker.runCycle();

        assertThat(report.getTransientErrors()).isGreaterThanOrEqualTo(1);
        assertThat(report.getCompleted()).isZero();
    }
}
