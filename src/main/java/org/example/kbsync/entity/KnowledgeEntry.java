package org.example.kbsync.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * 社区知识条目。增删改由外部 CRUD 负责，这里只在变更流中读取（cloud）
 * 或写入从 cloud 拉取来的副本（local）。
 */
@Data
@Entity
@Table(name = "knowledge_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_knowledge_origin", columnNames = {"source_instance", "origin_id"}),
        indexes = @Index(name = "idx_knowledge_updated", columnList = "updated_at, id"))
public class KnowledgeEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;
    @Column(columnDefinition = "TEXT", nullable = false)
    private String description;
    private String tags;
    private String location;
    private String hazardType;
    private String source;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_instance", length = 16)
    private InstanceTier sourceInstance;
    // 在创建它的实例上的 id，本地创建的条目为空
    @Column(name = "origin_id")
    private Long originId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
