package org.example.kbsync.worker;

import lombok.Data;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.config.SyncProperties;
import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.ProcessingMode;
import org.example.kbsync.entity.SyncLog;
import org.example.kbsync.entity.SyncMetadata;
import org.example.kbsync.entity.dto.ClaimResponse;
import org.example.kbsync.entity.dto.ProcessedContentRequest;
import org.example.kbsync.entity.dto.PullResponse;
import org.example.kbsync.entity.dto.PushRequest;
import org.example.kbsync.entity.dto.PushResponse;
import org.example.kbsync.entity.dto.SubmitResponse;
import org.example.kbsync.entity.dto.UnprocessedDocument;
import org.example.kbsync.entity.dto.UnprocessedPage;
import org.example.kbsync.extraction.ExtractionException;
import org.example.kbsync.extraction.ExtractionPipeline;
import org.example.kbsync.extraction.ExtractionResult;
import org.example.kbsync.service.PulledChangeApplier;
import org.example.kbsync.service.SyncAuditService;
import org.example.kbsync.utils.ContentHashes;
import org.example.kbsync.utils.Timestamps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * local 实例的同步 worker：拉取 cloud 变更，然后逐个认领、下载、完整抽取并回传待处理文档。
 * 文档按列表顺序串行处理，单个文档的失败不会中断本轮的其它文档。
 * cloud 以 401/403 拒绝同步密钥后 worker 停止，之后不再发起任何请求，直到进程以新密钥重启。
 */
@Slf4j
public class SyncWorker {

    private final SyncClient syncClient;
    private final ExtractionPipeline extractionPipeline;
    private final PulledChangeApplier pulledChangeApplier;
    private final SyncAuditService syncAuditService;
    private final SyncProperties syncProperties;
    private final Clock clock;

    @Getter
    private final Duration interval;
    @Getter
    private volatile Instant lastRunAt;
    @Getter
    private volatile String pullCursor;
    @Getter
    private volatile boolean halted;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public SyncWorker(SyncClient syncClient,
                      ExtractionPipeline extractionPipeline,
                      PulledChangeApplier pulledChangeApplier,
                      SyncAuditService syncAuditService,
                      SyncProperties syncProperties,
                      Clock clock) {
        this.syncClient = syncClient;
        this.extractionPipeline = extractionPipeline;
        this.pulledChangeApplier = pulledChangeApplier;
        this.syncAuditService = syncAuditService;
        this.syncProperties = syncProperties;
        this.clock = clock;
        this.interval = syncProperties.getWorker().getInterval();
        this.pullCursor = syncAuditService.getMetadata(SyncMetadata.PULL_CURSOR).orElse(null);
    }

    public boolean isDue() {
        return lastRunAt == null || !clock.instant().isBefore(lastRunAt.plus(interval));
    }

    /**
     * 调度器每个 tick 调用一次，到期才真正执行
     */
    public void runIfDue() {
        if (!halted && isDue()) {
            runCycle();
        }
    }

    /**
     * 执行一轮同步。上一轮尚未结束时直接返回空报告。
     */
    public CycleReport runCycle() {
        CycleReport report = new CycleReport();
        if (halted) {
            log.debug("同步密钥已被 cloud 拒绝，worker 已停止");
            return report;
        }
        if (!running.compareAndSet(false, true)) {
            log.info("上一轮同步仍在执行，跳过本次触发");
            return report;
        }
        lastRunAt = clock.instant();
        SyncLog syncLog = syncAuditService.start(SyncLog.TYPE_PROCESS);
        try {
            pullChanges(report);
            if (!halted) {
                processQueue(report);
            }
            if (halted) {
                syncAuditService.fail(syncLog, "同步密钥被 cloud 拒绝，worker 已停止");
                return report;
            }
            syncAuditService.complete(syncLog, report.getCompleted() + report.getFailed(), report.toDetails());
            syncAuditService.putMetadata(SyncMetadata.LAST_SYNC_TIMESTAMP, Timestamps.now(clock).toString());
            log.info("本轮同步结束: {}", report);
        } catch (RuntimeException e) {
            log.error("本轮同步异常终止: {}", report, e);
            syncAuditService.fail(syncLog, e.getMessage());
        } finally {
            running.set(false);
        }
        return report;
    }

    private void pullChanges(CycleReport report) {
        try {
            boolean hasMore = true;
            while (hasMore) {
                PullResponse page = syncClient.pull(null, pullCursor, syncProperties.getPullPageSize());
                report.setPulled(report.getPulled() + page.getRecords().size());
                report.setEntriesApplied(report.getEntriesApplied() + pulledChangeApplier.apply(page.getRecords()));
                pullCursor = page.getNextCursor();
                syncAuditService.putMetadata(SyncMetadata.PULL_CURSOR, pullCursor);
                hasMore = page.isHasMore() && !page.getRecords().isEmpty();
            }
        } catch (SyncClientException e) {
            if (haltOnAuthFailure(e)) {
                return;
            }
            //拉取失败不影响处理队列，下一轮从已保存的游标继续
            log.warn("拉取 cloud 变更失败: {}", e.getMessage());
            report.setTransientErrors(report.getTransientErrors() + 1);
        }
    }

    private void processQueue(CycleReport report) {
        String cursor = null;
        boolean hasMore = true;
        while (hasMore) {
            UnprocessedPage page;
            try {
                page = syncClient.listUnprocessed(cursor, syncProperties.getPageSize());
            } catch (SyncClientException e) {
                if (haltOnAuthFailure(e)) {
                    return;
                }
                log.warn("获取待处理文档列表失败，结束本轮: {}", e.getMessage());
                report.setTransientErrors(report.getTransientErrors() + 1);
                return;
            }
            List<Pending> batch = new ArrayList<>();
            for (UnprocessedDocument item : page.getItems()) {
                if (halted) {
                    return;
                }
                Pending pending = prepare(item, report);
                if (pending == null) {
                    continue;
                }
                if (syncProperties.getWorker().isBatchPush()) {
                    batch.add(pending);
                } else {
                    submit(pending, report);
                }
            }
            if (!batch.isEmpty() && !halted) {
                pushBatch(batch, report);
            }
            cursor = page.getNextCursor();
            hasMore = page.isHasMore() && !page.getItems().isEmpty();
        }
    }

    /**
     * 认领、下载并抽取，返回待提交的结果。认领或下载失败时返回空。
     */
    private Pending prepare(UnprocessedDocument item, CycleReport report) {
        Long documentId = item.getId();
        ClaimResponse claim;
        try {
            claim = syncClient.claim(documentId, item.getClaimToken());
        } catch (SyncRejectedException e) {
            if (haltOnAuthFailure(e)) {
                return null;
            }
            log.info("文档 {} 认领被拒绝，可能已被其它实例处理: {}", documentId, e.getMessage());
            report.setSkipped(report.getSkipped() + 1);
            return null;
        } catch (SyncTransportException e) {
            log.warn("文档 {} 认领失败: {}", documentId, e.getMessage());
            report.setTransientErrors(report.getTransientErrors() + 1);
            return null;
        }
        report.setClaimed(report.getClaimed() + 1);
        String leaseToken = claim.getLeaseToken();

        byte[] data;
        try {
            data = syncClient.download(documentId, leaseToken);
        } catch (SyncClientException e) {
            if (haltOnAuthFailure(e)) {
                return null;
            }
            //保留认领，由 cloud 在租约超时后释放
            log.warn("文档 {} 下载失败，等待租约超时后重试: {}", documentId, e.getMessage());
            report.setTransientErrors(report.getTransientErrors() + 1);
            return null;
        }

        ProcessedContentRequest request;
        try {
            ExtractionPipeline.Outcome outcome = extractionPipeline.run(item.getFilename(), data, InstanceTier.LOCAL);
            ExtractionResult result = outcome.getResult();
            String content = ContentHashes.canonicalize(result.getContent());
            request = ProcessedContentRequest.builder()
                    .documentId(documentId)
                    .claimToken(leaseToken)
                    .content(content)
                    .contentHash(ContentHashes.sha256(content))
                    .extractedMetadata(result.getMetadata())
                    .processingMode(ProcessingMode.LOCAL_FULL)
                    .build();
        } catch (ExtractionException e) {
            log.warn("文档 {} 本地抽取失败: {}", documentId, e.getMessage());
            request = failureReport(documentId, leaseToken, e.getMessage());
        } catch (RuntimeException e) {
            log.error("文档 {} 本地抽取异常", documentId, e);
            request = failureReport(documentId, leaseToken, "抽取异常: " + e.getMessage());
        }
        return new Pending(documentId, leaseToken, request);
    }

    private void submit(Pending pending, CycleReport report) {
        Long documentId = pending.getDocumentId();
        try {
            SubmitResponse response = syncClient.submit(documentId, pending.getRequest());
            tally(response, report);
        } catch (SyncTransportException e) {
            log.warn("文档 {} 提交失败，释放认领: {}", documentId, e.getMessage());
            report.setTransientErrors(report.getTransientErrors() + 1);
            releaseQuietly(pending, "提交失败: " + e.getMessage());
        } catch (SyncRejectedException e) {
            if (haltOnAuthFailure(e)) {
                return;
            }
            if (e.isConflict()) {
                log.warn("文档 {} 提交冲突: {}", documentId, e.getMessage());
                report.setConflicts(report.getConflicts() + 1);
            } else {
                log.error("文档 {} 提交被拒绝[{}]: {}", documentId, e.getStatus(), e.getMessage());
                report.setSkipped(report.getSkipped() + 1);
            }
        }
    }

    private void pushBatch(List<Pending> batch, CycleReport report) {
        PushRequest request = new PushRequest(batch.stream().map(Pending::getRequest).toList(), Timestamps.now(clock));
        try {
            PushResponse response = syncClient.push(request);
            response.getResults().forEach(r -> tally(r, report));
            for (PushResponse.PushError error : response.getErrors()) {
                if (error.getCode() == 409) {
                    report.setConflicts(report.getConflicts() + 1);
                }
                log.warn("批量推送中文档 {} 未被接受[{}]: {}", error.getDocumentId(), error.getCode(), error.getError());
            }
        } catch (SyncClientException e) {
            if (haltOnAuthFailure(e)) {
                return;
            }
            log.warn("批量推送失败，释放本批 {} 个认领: {}", batch.size(), e.getMessage());
            report.setTransientErrors(report.getTransientErrors() + 1);
            batch.forEach(p -> releaseQuietly(p, "批量推送失败: " + e.getMessage()));
        }
    }

    /**
     * 401/403 时停止 worker 并返回 true。已认领的文档由 cloud 在租约超时后释放。
     */
    private boolean haltOnAuthFailure(SyncClientException e) {
        if (!(e instanceof SyncRejectedException) || !((SyncRejectedException) e).isAuthFailure()) {
            return false;
        }
        halted = true;
        log.error("cloud 拒绝了同步密钥[{}]，worker 停止，请检查 kb.sync.api-key 后重启: {}",
                ((SyncRejectedException) e).getStatus(), e.getMessage());
        return true;
    }

    private void tally(SubmitResponse response, CycleReport report) {
        switch (response.getOutcome()) {
            case APPLIED, DUPLICATE -> report.setCompleted(report.getCompleted() + 1);
            case FAILED -> report.setFailed(report.getFailed() + 1);
            case REQUEUED -> report.setRequeued(report.getRequeued() + 1);
        }
        log.info("文档 {} 提交结果: {} 状态={}", response.getDocumentId(),
                response.getOutcome().getValue(), response.getProcessingStatus().getValue());
    }

    private void releaseQuietly(Pending pending, String reason) {
        try {
            syncClient.release(pending.getDocumentId(), pending.getLeaseToken(), reason);
        } catch (SyncClientException e) {
            log.warn("文档 {} 释放认领失败，等待 cloud 租约超时: {}", pending.getDocumentId(), e.getMessage());
        }
    }

    private static ProcessedContentRequest failureReport(Long documentId, String leaseToken, String error) {
        return ProcessedContentRequest.builder()
                .documentId(documentId)
                .claimToken(leaseToken)
                .processingMode(ProcessingMode.LOCAL_FULL)
                .error(error)
                .build();
    }

    @Value
    private static class Pending {
        Long documentId;
        String leaseToken;
        ProcessedContentRequest request;
    }

    @Data
    public static class CycleReport {
        private int pulled;
        private int entriesApplied;
        private int claimed;
        private int completed;
        private int failed;
        private int requeued;
        private int skipped;
        private int conflicts;
        private int transientErrors;

        Map<String, Object> toDetails() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("pulled", pulled);
            details.put("entriesApplied", entriesApplied);
            details.put("claimed", claimed);
            details.put("completed", completed);
            details.put("failed", failed);
            details.put("requeued", requeued);
            details.put("skipped", skipped);
            details.put("conflicts", conflicts);
            details.put("transientErrors", transientErrors);
            return details;
        }
    }
}
