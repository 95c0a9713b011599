package org.example.kbsync.entity.dto;

import lombok.Data;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.ProcessingMode;
import org.example.kbsync.entity.ProcessingStatus;

import java.time.Instant;

@Data
public class DocumentStatusResponse {
    private Long id;
    private String title;
    private ProcessingStatus processingStatus;
    private ProcessingMode processingMode;
    private boolean needsFullProcessing;
    private int attemptCount;
    private String errorMessage;
    private Instant processedAt;
    private Instant updatedAt;

    public static DocumentStatusResponse from(KbDocument doc) {
        DocumentStatusResponse response = new DocumentStatusResponse();
        response.setId(doc.getId());
        response.setTitle(doc.getTitle());
        response.setProcessingStatus(doc.getProcessingStatus());
        response.setProcessingMode(doc.getProcessingMode());
        response.setNeedsFullProcessing(doc.isNeedsFullProcessing());
        response.setAttemptCount(doc.getAttemptCount());
        response.setErrorMessage(doc.getErrorMessage());
        response.setProcessedAt(doc.getProcessedAt());
        response.setUpdatedAt(doc.getUpdatedAt());
        return response;
    }
}
