package org.example.kbsync.worker;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * 应用就绪后按固定间隔检查 worker 是否到期
 */
@Slf4j
@RequiredArgsConstructor
public class SyncWorkerScheduler {

    private final SyncWorker syncWorker;
    private final TaskScheduler taskScheduler;
    private final Duration tick;
    private final Clock clock;

    private ScheduledFuture<?> future;

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (future != null) {
            return;
        }
        // 首次检查在一个 tick 之后
        future = taskScheduler.scheduleWithFixedDelay(syncWorker::runIfDue, clock.instant().plus(tick), tick);
        log.info("同步 worker 已启动，周期 {}，检查间隔 {}", syncWorker.getInterval(), tick);
    }

    @PreDestroy
    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
            log.info("同步 worker 已停止");
        }
    }
}
