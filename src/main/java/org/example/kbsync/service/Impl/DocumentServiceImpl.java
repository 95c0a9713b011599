package org.example.kbsync.service.Impl;

import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.common.BusinessException;
import org.example.kbsync.common.ResultCode;
import org.example.kbsync.config.DeploymentProperties;
import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.ProcessingMode;
import org.example.kbsync.entity.ProcessingStatus;
import org.example.kbsync.entity.dto.DocumentStatusResponse;
import org.example.kbsync.entity.dto.ProcessingStats;
import org.example.kbsync.entity.dto.UploadMetadata;
import org.example.kbsync.entity.dto.UploadResponse;
import org.example.kbsync.extraction.ExtractionEngineRegistry;
import org.example.kbsync.extraction.ExtractionException;
import org.example.kbsync.extraction.ExtractionPipeline;
import org.example.kbsync.extraction.ExtractionResult;
import org.example.kbsync.extraction.FileType;
import org.example.kbsync.repository.KbDocumentRepository;
import org.example.kbsync.service.DocumentEventPublisher;
import org.example.kbsync.service.DocumentService;
import org.example.kbsync.service.DocumentStateMachine;
import org.example.kbsync.service.StorageService;
import org.example.kbsync.utils.Timestamps;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private final KbDocumentRepository kbDocumentRepository;
    private final StorageService storageService;
    private final ExtractionPipeline extractionPipeline;
    private final ExtractionEngineRegistry extractionEngineRegistry;
    private final DocumentStateMachine stateMachine;
    private final DocumentEventPublisher documentEventPublisher;
    private final DeploymentProperties deploymentProperties;
    private final Clock clock;

    @Override
    @Transactional
    public UploadResponse upload(MultipartFile file, UploadMetadata metadata) {
        String originalFilename = file.getOriginalFilename();
        if (file.isEmpty() || originalFilename == null || originalFilename.isBlank()) {
            throw new BusinessException(ResultCode.VALIDATE_FAILED, "上传文件不能为空");
        }
        if (file.getSize() > deploymentProperties.maxUploadSizeBytes()) {
            throw new BusinessException(ResultCode.PAYLOAD_TOO_LARGE,
                    "文件大小超过上限 " + deploymentProperties.getMaxUploadSizeMb() + "MB");
        }
        byte[] data;
        try {
            data = file.getBytes();
        } catch (IOException e) {
            log.error("读取上传文件失败:", e);
            throw new BusinessException(ResultCode.FAILED, "读取上传文件失败: " + e.getMessage());
        }

        //原文件落盘，local 实例之后按这个 key 下载
        String extension = FileType.extensionOf(originalFilename);
        String objectName = "uploads/" + UUID.randomUUID() + (extension.isEmpty() ? "" : "." + extension);
        storageService.upload(objectName, new ByteArrayInputStream(data));
        deleteStoredFileOnRollback(objectName);

        //数据库登记
        KbDocument kbDoc = new KbDocument();
        kbDoc.setFilename(originalFilename);
        kbDoc.setTitle(titleOf(metadata, originalFilename));
        if (metadata != null) {
            kbDoc.setDescription(metadata.getDescription());
            kbDoc.setTags(metadata.getTags());
            kbDoc.setLocation(metadata.getLocation());
            kbDoc.setHazardType(metadata.getHazardType());
            kbDoc.setSource(metadata.getSource());
        }
        kbDoc.setFilepath(objectName);
        kbDoc.setFiletype(file.getContentType());
        kbDoc.setFileExtension(extension);
        kbDoc.setFileSize(file.getSize());
        kbDoc.setProcessingStatus(ProcessingStatus.PENDING);
        Instant now = Timestamps.now(clock);
        kbDoc.setCreatedAt(now);
        kbDoc.setUpdatedAt(now);
        kbDoc = kbDocumentRepository.save(kbDoc);
        log.info("文档已登记，ID={} 文件名={} 大小={}", kbDoc.getId(), originalFilename, file.getSize());

        kbDoc = stateMachine.startProcessing(kbDoc);
        kbDoc = process(kbDoc, data);
        return new UploadResponse(kbDoc.getId(), kbDoc.getTitle(), kbDoc.getProcessingStatus(),
                kbDoc.getProcessingMode(), kbDoc.isNeedsFullProcessing(), messageFor(kbDoc));
    }

    /**
     * 登记事务回滚时删除已落盘的原文件，存储中不留没有文档记录的对象
     */
    private void deleteStoredFileOnRollback(String objectName) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_ROLLED_BACK) {
                    return;
                }
                try {
                    storageService.delete(objectName);
                    log.info("上传事务已回滚，删除原文件 {}", objectName);
                } catch (BusinessException e) {
                    log.error("上传事务已回滚，原文件 {} 未能删除，需人工清理: {}", objectName, e.getMessage());
                }
            }
        });
    }

    @Override
    public DocumentStatusResponse getStatus(Long documentId) {
        return DocumentStatusResponse.from(findDocument(documentId));
    }

    @Override
    public ProcessingStats getStats() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (ProcessingStatus status : ProcessingStatus.values()) {
            byStatus.put(status.getValue(), 0L);
        }
        kbDocumentRepository.countByStatus().forEach(c ->
                byStatus.put(((ProcessingStatus) c.getGroupKey()).getValue(), c.getTotal()));

        Map<String, Long> byMode = new LinkedHashMap<>();
        for (ProcessingMode mode : ProcessingMode.values()) {
            byMode.put(mode.getValue(), 0L);
        }
        kbDocumentRepository.countByMode().forEach(c ->
                byMode.put(((ProcessingMode) c.getGroupKey()).getValue(), c.getTotal()));

        InstanceTier tier = deploymentProperties.getTier();
        ProcessingStats stats = new ProcessingStats();
        stats.setByStatus(byStatus);
        stats.setByMode(byMode);
        stats.setNeedsFullProcessing(kbDocumentRepository.countByNeedsFullProcessingTrue());
        stats.setTotal(byStatus.values().stream().mapToLong(Long::longValue).sum());
        stats.setTier(tier);
        stats.setFinalFormats(extractionEngineRegistry.finalFormats(tier));
        stats.setDeferredFormats(extractionEngineRegistry.deferredFormats(tier));
        return stats;
    }

    @Override
    @Transactional
    public DocumentStatusResponse reprocess(Long documentId) {
        KbDocument kbDoc = findDocument(documentId);
        if (kbDoc.getProcessingStatus() != ProcessingStatus.FAILED) {
            throw BusinessException.conflict("只有失败的文档可以重新处理，当前状态: "
                    + kbDoc.getProcessingStatus().getValue());
        }
        //需要完整处理的文档直接重新排队，其余的按原文件重跑一次抽取
        if (kbDoc.isNeedsFullProcessing()) {
            kbDoc = stateMachine.requeue(kbDoc);
            log.info("文档 {} 已重新进入本地处理队列", documentId);
        } else {
            byte[] data = readStored(kbDoc);
            kbDoc = stateMachine.reset(kbDoc);
            kbDoc = stateMachine.startProcessing(kbDoc);
            kbDoc = process(kbDoc, data);
        }
        return DocumentStatusResponse.from(kbDoc);
    }

    private KbDocument process(KbDocument kbDoc, byte[] data) {
        InstanceTier tier = deploymentProperties.getTier();
        try {
            ExtractionPipeline.Outcome outcome = extractionPipeline.run(kbDoc.getFilename(), data, tier);
            ExtractionResult result = outcome.getResult();
            if (outcome.isFinal()) {
                kbDoc = stateMachine.complete(kbDoc, result.getContent(), result.getMetadata(),
                        outcome.getStrategy().getMode(), tier);
                documentEventPublisher.publishProcessed(kbDoc);
                return kbDoc;
            }
            return result == null
                    ? stateMachine.deferToLocal(kbDoc, null, null, null)
                    : stateMachine.deferToLocal(kbDoc, result.getContent(), result.getMetadata(),
                    outcome.getStrategy().getMode());
        } catch (ExtractionException e) {
            return stateMachine.fail(kbDoc, e.getMessage());
        } catch (RuntimeException e) {
            log.error("处理文件时出错: 文档ID={}", kbDoc.getId(), e);
            return stateMachine.fail(kbDoc, "处理文件时出错: " + e.getMessage());
        }
    }

    private byte[] readStored(KbDocument kbDoc) {
        try (InputStream in = storageService.getFileStream(kbDoc.getFilepath())) {
            return in.readAllBytes();
        } catch (IOException e) {
            log.error("读取原始文件失败: 文档ID={}", kbDoc.getId(), e);
            throw new BusinessException(ResultCode.FAILED, "读取原始文件失败: " + e.getMessage());
        }
    }

    private KbDocument findDocument(Long documentId) {
        return kbDocumentRepository.findById(documentId)
                .orElseThrow(() -> BusinessException.notFound("文档", documentId));
    }

    private static String titleOf(UploadMetadata metadata, String filename) {
        if (metadata != null && metadata.getTitle() != null && !metadata.getTitle().isBlank()) {
            return metadata.getTitle();
        }
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private static String messageFor(KbDocument kbDoc) {
        return switch (kbDoc.getProcessingStatus()) {
            case COMPLETED -> "文件处理完成";
            case NEEDS_LOCAL -> "文件已上传，等待本地实例完整处理";
            case FAILED -> "文件处理失败: " + kbDoc.getErrorMessage();
            default -> "文件已上传，正在处理";
        };
    }
}
