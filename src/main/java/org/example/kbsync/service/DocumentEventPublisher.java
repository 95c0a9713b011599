package org.example.kbsync.service;

import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.SyncConflict;

/**
 * 文档事件出口：内容定稿通知下游，同步冲突通知运维
 */
public interface DocumentEventPublisher {

    void publishProcessed(KbDocument document);

    void publishConflict(SyncConflict conflict);
}
