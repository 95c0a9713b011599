package org.example.kbsync.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@Entity
@Table(name = "sync_metadata")
public class SyncMetadata {

    public static final String LAST_SYNC_TIMESTAMP = "last_sync_timestamp";
    public static final String LAST_PULL_TIMESTAMP = "last_pull_timestamp";
    public static final String LAST_PUSH_TIMESTAMP = "last_push_timestamp";
    public static final String PULL_CURSOR = "pull_cursor";

    @Id
    @Column(name = "meta_key", length = 100)
    private String key;

    @Column(name = "meta_value", columnDefinition = "TEXT")
    private String value;

    private Instant updatedAt;

    public SyncMetadata(String key) {
        this.key = key;
    }
}
