package org.example.kbsync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.SyncConflict;
import org.example.kbsync.entity.SyncLog;
import org.example.kbsync.entity.SyncMetadata;
import org.example.kbsync.repository.SyncConflictRepository;
import org.example.kbsync.repository.SyncLogRepository;
import org.example.kbsync.repository.SyncMetadataRepository;
import org.example.kbsync.utils.Timestamps;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * 同步日志、同步元数据与冲突记录。
 * 每次写入都在独立事务中提交，外层业务回滚时审计记录仍然保留。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncAuditService {

    private final SyncLogRepository syncLogRepository;
    private final SyncMetadataRepository syncMetadataRepository;
    private final SyncConflictRepository syncConflictRepository;
    private final DocumentEventPublisher documentEventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public SyncLog start(String syncType) {
        SyncLog syncLog = new SyncLog();
        syncLog.setSyncType(syncType);
        syncLog.setStatus(SyncLog.STATUS_STARTED);
        syncLog.setStartedAt(Timestamps.now(clock));
        return syncLogRepository.save(syncLog);
    }

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public SyncLog complete(SyncLog syncLog, int documentsProcessed, Map<String, Object> details) {
        syncLog.setStatus(SyncLog.STATUS_COMPLETED);
        syncLog.setDocumentsProcessed(documentsProcessed);
        syncLog.setDetails(toJson(details));
        syncLog.setCompletedAt(Timestamps.now(clock));
        return syncLogRepository.save(syncLog);
    }

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public SyncLog fail(SyncLog syncLog, String errorMessage) {
        syncLog.setStatus(SyncLog.STATUS_FAILED);
        syncLog.setErrorMessage(errorMessage);
        syncLog.setCompletedAt(Timestamps.now(clock));
        return syncLogRepository.save(syncLog);
    }

    public Optional<String> getMetadata(String key) {
        return syncMetadataRepository.findById(key).map(SyncMetadata::getValue);
    }

    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public void putMetadata(String key, String value) {
        SyncMetadata metadata = syncMetadataRepository.findById(key).orElseGet(() -> new SyncMetadata(key));
        metadata.setValue(value);
        metadata.setUpdatedAt(Timestamps.now(clock));
        syncMetadataRepository.save(metadata);
    }

    /**
     * 记录被拒绝的本地推送，并通知运维
     */
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public SyncConflict recordConflict(KbDocument doc, String rejectedHash, InstanceTier sourceInstance) {
        SyncConflict conflict = new SyncConflict();
        conflict.setDocumentId(doc.getId());
        conflict.setAcceptedHash(doc.getContentHash());
        conflict.setRejectedHash(rejectedHash);
        conflict.setSourceInstance(sourceInstance);
        conflict.setDetectedAt(Timestamps.now(clock));
        conflict = syncConflictRepository.save(conflict);
        log.warn("同步冲突：文档 {} 已有 local_full 结果 {}，拒绝新的结果 {}",
                doc.getId(), doc.getContentHash(), rejectedHash);
        documentEventPublisher.publishConflict(conflict);
        return conflict;
    }

    private String toJson(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("同步日志详情无法序列化: {}", e.getMessage());
            return String.valueOf(details);
        }
    }
}
