package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.kbsync.entity.ProcessingMode;

import java.util.Map;

/**
 * local 实例提交的处理结果。error 不为空表示抽取失败，cloud 侧据此把文档置为 failed。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedContentRequest {
    // 单条提交时取路径参数，批量推送时必填
    private Long documentId;
    private String claimToken;
    private String content;
    private Map<String, Object> extractedMetadata;
    private String contentHash;
    private ProcessingMode processingMode;
    private String error;

    public boolean isFailureReport() {
        return error != null && !error.isBlank();
    }
}
