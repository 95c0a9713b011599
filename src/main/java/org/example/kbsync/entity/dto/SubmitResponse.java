package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.ProcessingMode;
import org.example.kbsync.entity.ProcessingStatus;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitResponse {
    private Long documentId;
    private SubmitOutcome outcome;
    private ProcessingStatus processingStatus;
    private ProcessingMode processingMode;
    private int attemptCount;

    public static SubmitResponse of(KbDocument doc, SubmitOutcome outcome) {
        return new SubmitResponse(doc.getId(), outcome, doc.getProcessingStatus(),
                doc.getProcessingMode(), doc.getAttemptCount());
    }
}
