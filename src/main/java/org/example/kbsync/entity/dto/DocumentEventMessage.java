package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.ProcessingMode;

import java.io.Serializable;
import java.time.Instant;

/**
 * 文档内容定稿后发往下游（向量索引、知识图谱抽取）的消息
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DocumentEventMessage implements Serializable {
    private Long docId;
    private String title;
    private ProcessingMode processingMode;
    private String contentHash;
    private InstanceTier sourceInstance;
    private Instant processedAt;
}
