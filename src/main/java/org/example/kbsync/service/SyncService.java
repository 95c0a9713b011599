package org.example.kbsync.service;

import org.example.kbsync.entity.dto.ClaimRequest;
import org.example.kbsync.entity.dto.ClaimResponse;
import org.example.kbsync.entity.dto.DocumentStatusResponse;
import org.example.kbsync.entity.dto.ProcessedContentRequest;
import org.example.kbsync.entity.dto.PullResponse;
import org.example.kbsync.entity.dto.PushRequest;
import org.example.kbsync.entity.dto.PushResponse;
import org.example.kbsync.entity.dto.ReleaseRequest;
import org.example.kbsync.entity.dto.StoredFile;
import org.example.kbsync.entity.dto.SubmitResponse;
import org.example.kbsync.entity.dto.SyncStatusResponse;
import org.example.kbsync.entity.dto.UnprocessedPage;

import java.time.Instant;

/**
 * cloud 侧的同步协议实现。所有写操作都可安全重试。
 */
public interface SyncService {

    /**
     * 按 id 升序列出等待本地处理的文档
     * @param cursor 上一页最后一条的 id，首页为空
     */
    UnprocessedPage listUnprocessed(String cursor, Integer limit);

    /**
     * 用排队令牌认领文档，换取租约令牌
     */
    ClaimResponse claim(Long documentId, ClaimRequest request);

    /**
     * 持有租约时下载原文件
     */
    StoredFile download(Long documentId, String leaseToken);

    /**
     * 提交本地处理结果，对 (documentId, contentHash) 幂等
     */
    SubmitResponse submit(Long documentId, ProcessedContentRequest request);

    /**
     * 放弃租约，文档回到队列，尝试次数加一
     */
    DocumentStatusResponse release(Long documentId, ReleaseRequest request);

    /**
     * 批量提交，每条独立生效
     */
    PushResponse push(PushRequest request);

    /**
     * 拉取 since 或游标之后的变更
     */
    PullResponse pull(Instant since, String cursor, Integer limit);

    SyncStatusResponse status();

    /**
     * 释放租约超时的认领
     * @return 释放的文档数
     */
    int reapExpiredClaims();
}
