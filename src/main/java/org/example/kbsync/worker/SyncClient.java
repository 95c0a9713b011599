package org.example.kbsync.worker;

import org.example.kbsync.entity.dto.ClaimResponse;
import org.example.kbsync.entity.dto.ProcessedContentRequest;
import org.example.kbsync.entity.dto.PullResponse;
import org.example.kbsync.entity.dto.PushRequest;
import org.example.kbsync.entity.dto.PushResponse;
import org.example.kbsync.entity.dto.SubmitResponse;
import org.example.kbsync.entity.dto.UnprocessedPage;

import java.time.Instant;

/**
 * local 实例访问配对 cloud 实例的同步接口。
 * 失败时抛出 {@link SyncTransportException} 或 {@link SyncRejectedException}。
 */
public interface SyncClient {

    UnprocessedPage listUnprocessed(String cursor, int limit);

    ClaimResponse claim(Long documentId, String claimToken);

    byte[] download(Long documentId, String leaseToken);

    SubmitResponse submit(Long documentId, ProcessedContentRequest request);

    void release(Long documentId, String leaseToken, String reason);

    PushResponse push(PushRequest request);

    PullResponse pull(Instant since, String cursor, int limit);
}
