package org.example.kbsync.service.Impl;

import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.common.BusinessException;
import org.example.kbsync.common.ResultCode;
import org.example.kbsync.config.DeploymentProperties;
import org.example.kbsync.config.SyncProperties;
import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.ProcessingMode;
import org.example.kbsync.entity.ProcessingStatus;
import org.example.kbsync.entity.SyncLog;
import org.example.kbsync.entity.SyncMetadata;
import org.example.kbsync.entity.dto.ClaimRequest;
import org.example.kbsync.entity.dto.ClaimResponse;
import org.example.kbsync.entity.dto.DocumentStatusResponse;
import org.example.kbsync.entity.dto.ProcessedContentRequest;
import org.example.kbsync.entity.dto.PullResponse;
import org.example.kbsync.entity.dto.PushRequest;
import org.example.kbsync.entity.dto.PushResponse;
import org.example.kbsync.entity.dto.ReleaseRequest;
import org.example.kbsync.entity.dto.StoredFile;
import org.example.kbsync.entity.dto.SubmitOutcome;
import org.example.kbsync.entity.dto.SubmitResponse;
import org.example.kbsync.entity.dto.SyncStatusResponse;
import org.example.kbsync.entity.dto.UnprocessedDocument;
import org.example.kbsync.entity.dto.UnprocessedPage;
import org.example.kbsync.repository.KbDocumentRepository;
import org.example.kbsync.repository.SyncConflictRepository;
import org.example.kbsync.repository.SyncLogRepository;
import org.example.kbsync.service.ChangeFeedService;
import org.example.kbsync.service.DocumentEventPublisher;
import org.example.kbsync.service.DocumentService;
import org.example.kbsync.service.DocumentStateMachine;
import org.example.kbsync.service.StorageService;
import org.example.kbsync.service.SyncAuditService;
import org.example.kbsync.service.SyncService;
import org.example.kbsync.utils.ChangeCursor;
import org.example.kbsync.utils.ContentHashes;
import org.example.kbsync.utils.Timestamps;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SyncServiceImpl implements SyncService {

    private static final int MAX_LIMIT = 500;

    private final KbDocumentRepository kbDocumentRepository;
    private final SyncLogRepository syncLogRepository;
    private final SyncConflictRepository syncConflictRepository;
    private final DocumentStateMachine stateMachine;
    private final StorageService storageService;
    private final DocumentService documentService;
    private final DocumentEventPublisher documentEventPublisher;
    private final ChangeFeedService changeFeedService;
    private final SyncAuditService syncAuditService;
    private final SyncProperties syncProperties;
    private final DeploymentProperties deploymentProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    public UnprocessedPage listUnprocessed(String cursor, Integer limit) {
        int pageSize = limitOf(limit, syncProperties.getPageSize());
        long afterId = 0L;
        if (cursor != null && !cursor.isBlank()) {
            try {
                afterId = Long.parseLong(cursor);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("游标格式错误: " + cursor, e);
            }
        }
        List<KbDocument> docs = kbDocumentRepository.findByProcessingStatusAndIdGreaterThanOrderByIdAsc(
                ProcessingStatus.NEEDS_LOCAL, afterId, PageRequest.of(0, pageSize + 1));
        boolean hasMore = docs.size() > pageSize;
        List<UnprocessedDocument> items = docs.stream()
                .limit(pageSize)
                .map(UnprocessedDocument::from)
                .toList();
        String nextCursor = items.isEmpty() ? cursor : String.valueOf(items.get(items.size() - 1).getId());
        return new UnprocessedPage(items, nextCursor, hasMore);
    }

    @Override
    @Transactional
    public ClaimResponse claim(Long documentId, ClaimRequest request) {
        KbDocument doc = findDocument(documentId);
        String claimToken = request == null ? null : request.getClaimToken();
        KbDocument claimed = stateMachine.claim(doc, claimToken)
                .orElseThrow(() -> BusinessException.conflict("文档 " + documentId + " 已被认领或令牌已失效"));
        return new ClaimResponse(claimed.getId(), claimed.getClaimToken(), claimed.getAttemptCount());
    }

    @Override
    public StoredFile download(Long documentId, String leaseToken) {
        KbDocument doc = findDocument(documentId);
        requireLease(doc, leaseToken);
        return new StoredFile(doc.getFilename(), doc.getFiletype(), doc.getFileSize(),
                storageService.getFileStream(doc.getFilepath()));
    }

    @Override
    public SubmitResponse submit(Long documentId, ProcessedContentRequest request) {
        SyncLog syncLog = syncAuditService.start(SyncLog.TYPE_PUSH);
        try {
            SubmitResponse response = transactionTemplate.execute(status -> applySubmission(documentId, request));
            syncAuditService.complete(syncLog, 1, Map.of("documentId", documentId, "outcome", response.getOutcome().getValue()));
            syncAuditService.putMetadata(SyncMetadata.LAST_PUSH_TIMESTAMP, Timestamps.now(clock).toString());
            return response;
        } catch (RuntimeException e) {
            syncAuditService.fail(syncLog, e.getMessage());
            throw e;
        }
    }

    @Override
    @Transactional
    public DocumentStatusResponse release(Long documentId, ReleaseRequest request) {
        KbDocument doc = findDocument(documentId);
        String reason = request == null || request.getReason() == null ? "本地实例放弃处理" : request.getReason();
        KbDocument released = stateMachine.release(doc, request == null ? null : request.getClaimToken(), reason)
                .orElseThrow(() -> BusinessException.conflict("文档 " + documentId + " 的租约已失效"));
        return DocumentStatusResponse.from(released);
    }

    @Override
    public PushResponse push(PushRequest request) {
        List<ProcessedContentRequest> items = request == null || request.getDocuments() == null
                ? List.of() : request.getDocuments();
        SyncLog syncLog = syncAuditService.start(SyncLog.TYPE_PUSH);
        PushResponse response = new PushResponse();
        for (ProcessedContentRequest item : items) {
            Long documentId = item.getDocumentId();
            try {
                if (documentId == null) {
                    throw new BusinessException(ResultCode.VALIDATE_FAILED, "批量推送的每一项都必须包含 documentId");
                }
                //每条单独开事务，一条失败不影响其它
                SubmitResponse result = transactionTemplate.execute(status -> applySubmission(documentId, item));
                response.getResults().add(result);
                if (result.getOutcome() == SubmitOutcome.REQUEUED) {
                    response.setFailedCount(response.getFailedCount() + 1);
                    response.getErrors().add(new PushResponse.PushError(documentId,
                            ResultCode.VALIDATE_FAILED.getCode(), "内容校验失败，已重新排队"));
                } else {
                    response.setProcessedCount(response.getProcessedCount() + 1);
                }
            } catch (BusinessException e) {
                log.warn("批量推送中文档 {} 被拒绝: {}", documentId, e.getMessage());
                response.setFailedCount(response.getFailedCount() + 1);
                response.getErrors().add(new PushResponse.PushError(documentId, e.getResultCode().getCode(), e.getMessage()));
            } catch (ObjectOptimisticLockingFailureException e) {
                log.warn("批量推送中文档 {} 并发修改冲突", documentId);
                response.setFailedCount(response.getFailedCount() + 1);
                response.getErrors().add(new PushResponse.PushError(documentId, ResultCode.CONFLICT.getCode(), "文档已被并发修改"));
            } catch (RuntimeException e) {
                log.error("批量推送中文档 {} 处理异常", documentId, e);
                response.setFailedCount(response.getFailedCount() + 1);
                response.getErrors().add(new PushResponse.PushError(documentId, ResultCode.FAILED.getCode(), e.getMessage()));
            }
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("received", items.size());
        details.put("failed", response.getFailedCount());
        if (request != null && request.getSyncTimestamp() != null) {
            details.put("syncTimestamp", request.getSyncTimestamp().toString());
        }
        syncAuditService.complete(syncLog, response.getProcessedCount(), details);
        syncAuditService.putMetadata(SyncMetadata.LAST_PUSH_TIMESTAMP, Timestamps.now(clock).toString());
        log.info("批量推送完成: 收到 {} 条，成功 {} 条，失败 {} 条",
                items.size(), response.getProcessedCount(), response.getFailedCount());
        return response;
    }

    @Override
    public PullResponse pull(Instant since, String cursor, Integer limit) {
        int pageSize = limitOf(limit, syncProperties.getPullPageSize());
        ChangeCursor start;
        if (cursor != null && !cursor.isBlank()) {
            start = ChangeCursor.decode(cursor);
        } else {
            start = ChangeCursor.since(since == null ? Instant.EPOCH : since);
        }
        SyncLog syncLog = syncAuditService.start(SyncLog.TYPE_PULL);
        Instant syncTimestamp = Timestamps.now(clock);
        Instant horizon = syncTimestamp.minus(syncProperties.getPullCommitLag());
        ChangeFeedService.Page page = changeFeedService.read(start, pageSize, horizon);
        syncAuditService.complete(syncLog, page.getRecords().size(), Map.of("hasMore", page.isHasMore()));
        syncAuditService.putMetadata(SyncMetadata.LAST_PULL_TIMESTAMP, syncTimestamp.toString());
        return new PullResponse(page.getRecords(), page.getNext().encode(), page.isHasMore(), syncTimestamp);
    }

    @Override
    public SyncStatusResponse status() {
        SyncStatusResponse response = new SyncStatusResponse();
        response.setTier(deploymentProperties.getTier());
        response.setSyncEnabled(syncProperties.isEnabled());
        response.setProcessingStats(documentService.getStats());
        response.setLastPull(syncAuditService.getMetadata(SyncMetadata.LAST_PULL_TIMESTAMP).orElse(null));
        response.setLastPush(syncAuditService.getMetadata(SyncMetadata.LAST_PUSH_TIMESTAMP).orElse(null));
        response.setLastSync(syncAuditService.getMetadata(SyncMetadata.LAST_SYNC_TIMESTAMP).orElse(null));
        response.setConflictCount(syncConflictRepository.count());
        response.setRecentSyncs(syncLogRepository.findTop10ByOrderByStartedAtDescIdDesc().stream()
                .map(SyncStatusResponse.SyncLogView::from)
                .toList());
        return response;
    }

    @Override
    public int reapExpiredClaims() {
        Instant cutoff = Timestamps.now(clock).minus(syncProperties.getClaimLeaseTimeout());
        List<KbDocument> expired = kbDocumentRepository.findByProcessingStatusAndClaimedAtBefore(
                ProcessingStatus.PROCESSING, cutoff);
        int released = 0;
        for (KbDocument doc : expired) {
            try {
                Boolean ok = transactionTemplate.execute(status -> stateMachine
                        .release(doc, doc.getClaimToken(), "认领租约超时")
                        .isPresent());
                if (Boolean.TRUE.equals(ok)) {
                    released++;
                }
            } catch (RuntimeException e) {
                log.error("释放超时认领失败，文档ID: {}", doc.getId(), e);
            }
        }
        if (released > 0) {
            log.warn("已释放 {} 个租约超时的认领", released);
        }
        return released;
    }

    /**
     * 在调用方事务中应用一次提交。只有本方法会写入 local_full 内容。
     */
    private SubmitResponse applySubmission(Long documentId, ProcessedContentRequest request) {
        if (request == null) {
            throw new BusinessException(ResultCode.VALIDATE_FAILED, "提交内容不能为空");
        }
        KbDocument doc = findDocument(documentId);
        String token = request.getClaimToken();

        //已有 local_full 结果：同内容幂等返回，不同内容记为冲突，保留已有结果
        if (doc.getProcessingStatus() == ProcessingStatus.COMPLETED
                && doc.getProcessingMode() == ProcessingMode.LOCAL_FULL) {
            if (request.isFailureReport()) {
                throw BusinessException.conflict("文档 " + documentId + " 已处理完成，忽略失败标记");
            }
            if (ContentHashes.matches(request.getContent(), doc.getContentHash())) {
                log.info("文档 {} 重复提交相同内容，忽略", documentId);
                return SubmitResponse.of(doc, SubmitOutcome.DUPLICATE);
            }
            syncAuditService.recordConflict(doc, ContentHashes.sha256(request.getContent()), InstanceTier.LOCAL);
            throw BusinessException.conflict("文档 " + documentId + " 已有本地完整处理结果，拒绝覆盖");
        }

        //失败标记的重试
        if (doc.getProcessingStatus() == ProcessingStatus.FAILED && request.isFailureReport()
                && token != null && token.equals(doc.getClaimToken())) {
            return SubmitResponse.of(doc, SubmitOutcome.FAILED);
        }

        requireLease(doc, token);

        if (request.isFailureReport()) {
            return SubmitResponse.of(stateMachine.fail(doc, "本地处理失败: " + request.getError()), SubmitOutcome.FAILED);
        }

        String validationError = validate(request);
        if (validationError != null) {
            log.warn("文档 {} 的提交内容校验失败: {}", documentId, validationError);
            KbDocument requeued = stateMachine.release(doc, token, "提交内容校验失败: " + validationError)
                    .orElseThrow(() -> BusinessException.conflict("文档 " + documentId + " 的租约已失效"));
            return SubmitResponse.of(requeued, SubmitOutcome.REQUEUED);
        }

        KbDocument completed = stateMachine.complete(doc, request.getContent(), request.getExtractedMetadata(),
                ProcessingMode.LOCAL_FULL, InstanceTier.LOCAL);
        documentEventPublisher.publishProcessed(completed);
        return SubmitResponse.of(completed, SubmitOutcome.APPLIED);
    }

    private static String validate(ProcessedContentRequest request) {
        if (ContentHashes.canonicalize(request.getContent()).isEmpty()) {
            return "内容为空";
        }
        if (request.getProcessingMode() != null && request.getProcessingMode() != ProcessingMode.LOCAL_FULL) {
            return "处理模式必须为 local_full";
        }
        if (!ContentHashes.matches(request.getContent(), request.getContentHash())) {
            return "内容摘要不匹配";
        }
        return null;
    }

    private void requireLease(KbDocument doc, String leaseToken) {
        if (doc.getProcessingStatus() != ProcessingStatus.PROCESSING
                || leaseToken == null || !leaseToken.equals(doc.getClaimToken())) {
            throw BusinessException.conflict("文档 " + doc.getId() + " 的认领已失效");
        }
    }

    private KbDocument findDocument(Long documentId) {
        return kbDocumentRepository.findById(documentId)
                .orElseThrow(() -> BusinessException.notFound("文档", documentId));
    }

    private static int limitOf(Integer requested, int defaultLimit) {
        if (requested == null) {
            return defaultLimit;
        }
        if (requested < 1) {
            throw new IllegalArgumentException("limit 必须大于 0");
        }
        return Math.min(requested, MAX_LIMIT);
    }
}
