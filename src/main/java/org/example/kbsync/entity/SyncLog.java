package org.example.kbsync.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Data
@Entity
@Table(name = "sync_log")
public class SyncLog {

    public static final String TYPE_PULL = "pull";
    public static final String TYPE_PUSH = "push";
    public static final String TYPE_PROCESS = "process";

    public static final String STATUS_STARTED = "started";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String syncType;
    @Column(nullable = false, length = 32)
    private String status;

    private int documentsProcessed;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;
    // JSON 格式的附加信息
    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(nullable = false)
    private Instant startedAt;
    private Instant completedAt;
}
