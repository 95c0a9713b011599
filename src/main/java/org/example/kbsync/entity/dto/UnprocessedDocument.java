package org.example.kbsync.entity.dto;

import lombok.Data;
import org.example.kbsync.entity.KbDocument;

import java.time.Instant;

@Data
public class UnprocessedDocument {
    private Long id;
    private String title;
    private String filename;
    private String fileExtension;
    private String filetype;
    private Long fileSize;
    private int attemptCount;
    private String claimToken;
    private String downloadPath;
    private Instant createdAt;
    private Instant updatedAt;

    public static UnprocessedDocument from(KbDocument doc) {
        UnprocessedDocument item = new UnprocessedDocument();
        item.setId(doc.getId());
        item.setTitle(doc.getTitle());
        item.setFilename(doc.getFilename());
        item.setFileExtension(doc.getFileExtension());
        item.setFiletype(doc.getFiletype());
        item.setFileSize(doc.getFileSize());
        item.setAttemptCount(doc.getAttemptCount());
        item.setClaimToken(doc.getClaimToken());
        item.setDownloadPath("/api/sync/documents/" + doc.getId() + "/download");
        item.setCreatedAt(doc.getCreatedAt());
        item.setUpdatedAt(doc.getUpdatedAt());
        return item;
    }
}
