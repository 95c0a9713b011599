package org.example.kbsync.repository;

import org.example.kbsync.entity.SyncMetadata;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncMetadataRepository extends JpaRepository<SyncMetadata, String> {
}
