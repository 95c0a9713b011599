package org.example.kbsync.repository;

import org.example.kbsync.entity.SyncLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SyncLogRepository extends JpaRepository<SyncLog, Long> {
    List<SyncLog> findTop10ByOrderByStartedAtDescIdDesc();
}
