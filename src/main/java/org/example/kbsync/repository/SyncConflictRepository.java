package org.example.kbsync.repository;

import org.example.kbsync.entity.SyncConflict;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SyncConflictRepository extends JpaRepository<SyncConflict, Long> {
    List<SyncConflict> findByDocumentIdOrderByDetectedAtAsc(Long documentId);
}
