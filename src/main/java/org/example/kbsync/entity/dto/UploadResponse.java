package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.kbsync.entity.ProcessingMode;
import org.example.kbsync.entity.ProcessingStatus;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {
    private Long id;
    private String title;
    private ProcessingStatus processingStatus;
    private ProcessingMode processingMode;
    private boolean needsFullProcessing;
    private String message;
}
