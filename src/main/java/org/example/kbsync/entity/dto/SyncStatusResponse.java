package org.example.kbsync.entity.dto;

import lombok.Data;
import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.SyncLog;

import java.time.Instant;
import java.util.List;

@Data
public class SyncStatusResponse {
    private InstanceTier tier;
    private boolean syncEnabled;
    private ProcessingStats processingStats;
    private String lastPull;
    private String lastPush;
    private String lastSync;
    private long conflictCount;
    private List<SyncLogView> recentSyncs;

    @Data
    public static class SyncLogView {
        private Long id;
        private String syncType;
        private String status;
        private int documentsProcessed;
        private String errorMessage;
        private Instant startedAt;
        private Instant completedAt;

        public static SyncLogView from(SyncLog log) {
            SyncLogView view = new SyncLogView();
            view.setId(log.getId());
            view.setSyncType(log.getSyncType());
            view.setStatus(log.getStatus());
            view.setDocumentsProcessed(log.getDocumentsProcessed());
            view.setErrorMessage(log.getErrorMessage());
            view.setStartedAt(log.getStartedAt());
            view.setCompletedAt(log.getCompletedAt());
            return view;
        }
    }
}
