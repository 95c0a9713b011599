package org.example.kbsync.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Data
@Entity
@Table(name = "kb_documents", indexes = {
        @Index(name = "idx_kb_documents_status", columnList = "processing_status"),
        @Index(name = "idx_kb_documents_updated", columnList = "updated_at, id")
})
public class KbDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;
    @Column(nullable = false, updatable = false)
    private String filename;

    @Column(columnDefinition = "TEXT")
    private String description;
    private String tags;
    private String location;
    private String hazardType;
    private String source;

    // 原始文件在存储中的 key，local 实例通过它下载原文件
    private String filepath;
    private String filetype;
    private String fileExtension;
    private Long fileSize;

    @Column(columnDefinition = "TEXT")
    private String content;
    private String contentHash;
    @Column(columnDefinition = "TEXT")
    private String extractedMetadata;

    // 状态机：PENDING, PROCESSING, COMPLETED, NEEDS_LOCAL, FAILED
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ProcessingStatus processingStatus;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private ProcessingMode processingMode;

    @Column(nullable = false)
    private boolean needsFullProcessing;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private InstanceTier sourceInstance;

    @Column(nullable = false)
    private int attemptCount;
    // needs_local 时为排队令牌，被认领后为租约令牌
    @Column(length = 64)
    private String claimToken;
    private Instant claimedAt;

    // 错误信息，用于排查问题
    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (processingStatus == null) processingStatus = ProcessingStatus.PENDING;
    }
}
