package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.kbsync.entity.InstanceTier;

import java.io.Serializable;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncConflictMessage implements Serializable {
    private Long conflictId;
    private Long documentId;
    private String acceptedHash;
    private String rejectedHash;
    private InstanceTier sourceInstance;
    private Instant detectedAt;
}
