package org.example.kbsync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.common.IllegalStateTransitionException;
import org.example.kbsync.config.SyncProperties;
import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.ProcessingMode;
import org.example.kbsync.entity.ProcessingStatus;
import org.example.kbsync.repository.KbDocumentRepository;
import org.example.kbsync.utils.ContentHashes;
import org.example.kbsync.utils.Timestamps;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 文档处理状态的唯一修改入口。
 * 认领与释放走条件更新（按受影响行数判断成败），其余迁移依赖 @Version 乐观锁。
 * 调用方负责开启事务。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentStateMachine {

    public static final String MAX_RETRIES_EXCEEDED = "超过最大重试次数";
    private static final int MAX_ERROR_LENGTH = 1000;

    private static final Set<ProcessingStatus> FAILABLE =
            EnumSet.of(ProcessingStatus.PENDING, ProcessingStatus.PROCESSING, ProcessingStatus.NEEDS_LOCAL);

    private final KbDocumentRepository kbDocumentRepository;
    private final SyncProperties syncProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * pending -> processing
     */
    public KbDocument startProcessing(KbDocument doc) {
        require(doc, EnumSet.of(ProcessingStatus.PENDING), "开始处理");
        doc.setProcessingStatus(ProcessingStatus.PROCESSING);
        return save(doc);
    }

    /**
     * processing -> completed，写入最终内容。已有 local_full 结果时不允许被更弱的结果覆盖。
     */
    public KbDocument complete(KbDocument doc, String content, Map<String, Object> metadata,
                               ProcessingMode mode, InstanceTier source) {
        require(doc, EnumSet.of(ProcessingStatus.PROCESSING), "完成处理");
        if (doc.getProcessingMode() != null && mode.isWeakerThan(doc.getProcessingMode())) {
            throw new IllegalStateTransitionException(doc.getId(), doc.getProcessingStatus(),
                    "用 " + mode.getValue() + " 覆盖 " + doc.getProcessingMode().getValue());
        }
        String canonical = ContentHashes.canonicalize(content);
        doc.setContent(canonical);
        doc.setContentHash(ContentHashes.sha256(canonical));
        doc.setExtractedMetadata(toJson(metadata));
        doc.setProcessingMode(mode);
        doc.setSourceInstance(source);
        doc.setProcessingStatus(ProcessingStatus.COMPLETED);
        doc.setClaimToken(null);
        doc.setClaimedAt(null);
        doc.setErrorMessage(null);
        Instant now = Timestamps.next(clock, doc.getUpdatedAt());
        doc.setProcessedAt(now);
        doc.setUpdatedAt(now);
        KbDocument saved = kbDocumentRepository.save(doc);
        log.info("文档 {} 处理完成，模式={} 来源={}", doc.getId(), mode.getValue(), source.getValue());
        return saved;
    }

    /**
     * processing -> needs_local。cloud 侧的部分结果（扫描件文本层）先行保存，随后会被 local 结果覆盖。
     */
    public KbDocument deferToLocal(KbDocument doc, String partialContent, Map<String, Object> metadata,
                                   ProcessingMode partialMode) {
        require(doc, EnumSet.of(ProcessingStatus.PROCESSING), "转入本地处理队列");
        if (partialContent != null && !partialContent.isBlank()) {
            String canonical = ContentHashes.canonicalize(partialContent);
            doc.setContent(canonical);
            doc.setContentHash(ContentHashes.sha256(canonical));
            doc.setExtractedMetadata(toJson(metadata));
            doc.setProcessingMode(partialMode);
            doc.setSourceInstance(InstanceTier.CLOUD);
        }
        doc.setNeedsFullProcessing(true);
        doc.setProcessingStatus(ProcessingStatus.NEEDS_LOCAL);
        doc.setClaimToken(newToken());
        doc.setClaimedAt(null);
        KbDocument saved = save(doc);
        log.info("文档 {} 需要完整处理，已进入本地处理队列", doc.getId());
        return saved;
    }

    /**
     * pending / processing / needs_local -> failed。失败原因截断后保存。
     */
    public KbDocument fail(KbDocument doc, String reason) {
        require(doc, FAILABLE, "标记失败");
        doc.setProcessingStatus(ProcessingStatus.FAILED);
        doc.setErrorMessage(truncate(reason));
        doc.setClaimedAt(null);
        KbDocument saved = save(doc);
        log.warn("文档 {} 处理失败: {}", doc.getId(), saved.getErrorMessage());
        return saved;
    }

    /**
     * failed -> needs_local，重置尝试次数，用于人工重新处理
     */
    public KbDocument requeue(KbDocument doc) {
        require(doc, EnumSet.of(ProcessingStatus.FAILED), "重新排队");
        doc.setAttemptCount(0);
        doc.setErrorMessage(null);
        doc.setNeedsFullProcessing(true);
        doc.setProcessingStatus(ProcessingStatus.NEEDS_LOCAL);
        doc.setClaimToken(newToken());
        doc.setClaimedAt(null);
        return save(doc);
    }

    /**
     * failed -> pending，重新走一遍上传时的抽取流程
     */
    public KbDocument reset(KbDocument doc) {
        require(doc, EnumSet.of(ProcessingStatus.FAILED), "重新处理");
        doc.setAttemptCount(0);
        doc.setErrorMessage(null);
        doc.setClaimToken(null);
        doc.setProcessingStatus(ProcessingStatus.PENDING);
        return save(doc);
    }

    /**
     * needs_local -> processing。排队令牌不匹配或已被他人认领时返回空。
     */
    public Optional<KbDocument> claim(KbDocument doc, String claimToken) {
        if (claimToken == null || claimToken.isBlank()) {
            return Optional.empty();
        }
        String leaseToken = newToken();
        Instant now = Timestamps.next(clock, doc.getUpdatedAt());
        int updated = kbDocumentRepository.claim(doc.getId(), claimToken, leaseToken, now);
        if (updated == 0) {
            log.info("文档 {} 认领失败，令牌已失效或已被认领", doc.getId());
            return Optional.empty();
        }
        log.info("文档 {} 已被认领，第 {} 次尝试", doc.getId(), doc.getAttemptCount() + 1);
        return kbDocumentRepository.findById(doc.getId());
    }

    /**
     * processing -> needs_local，尝试次数加一。达到上限后直接转为 failed。
     * 租约令牌不匹配时返回空。
     */
    public Optional<KbDocument> release(KbDocument doc, String leaseToken, String reason) {
        if (leaseToken == null || leaseToken.isBlank()) {
            return Optional.empty();
        }
        Instant now = Timestamps.next(clock, doc.getUpdatedAt());
        int updated = kbDocumentRepository.release(doc.getId(), leaseToken, newToken(), truncate(reason), now);
        if (updated == 0) {
            return Optional.empty();
        }
        KbDocument released = kbDocumentRepository.findById(doc.getId()).orElseThrow();
        if (released.getAttemptCount() >= syncProperties.getMaxAttempts()) {
            return Optional.of(fail(released, MAX_RETRIES_EXCEEDED + ": " + reason));
        }
        log.info("文档 {} 已释放回队列，已尝试 {} 次，原因: {}", doc.getId(), released.getAttemptCount(), reason);
        return Optional.of(released);
    }

    private KbDocument save(KbDocument doc) {
        doc.setUpdatedAt(Timestamps.next(clock, doc.getUpdatedAt()));
        return kbDocumentRepository.save(doc);
    }

    private void require(KbDocument doc, Set<ProcessingStatus> allowed, String transition) {
        if (!allowed.contains(doc.getProcessingStatus())) {
            throw new IllegalStateTransitionException(doc.getId(), doc.getProcessingStatus(), transition);
        }
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("抽取元数据无法序列化: " + e.getMessage(), e);
        }
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() <= MAX_ERROR_LENGTH ? reason : reason.substring(0, MAX_ERROR_LENGTH);
    }

    private static String newToken() {
        return UUID.randomUUID().toString();
    }
}
