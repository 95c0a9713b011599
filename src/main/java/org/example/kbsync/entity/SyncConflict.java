package org.example.kbsync.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * 被拒绝的本地推送记录，供运维人员排查重复或乱序处理
 */
@Data
@Entity
@Table(name = "sync_conflicts")
public class SyncConflict {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long documentId;
    private String acceptedHash;
    private String rejectedHash;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private InstanceTier sourceInstance;

    @Column(nullable = false)
    private Instant detectedAt;
}
