package org.example.kbsync.repository;

import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.ProcessingStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface KbDocumentRepository extends JpaRepository<KbDocument, Long> {

    // 按 id 升序分页，新入队的文档 id 更大，不会插到已读过的页里
    List<KbDocument> findByProcessingStatusAndIdGreaterThanOrderByIdAsc(ProcessingStatus status, Long afterId, Pageable pageable);

    List<KbDocument> findByProcessingStatusAndClaimedAtBefore(ProcessingStatus status, Instant claimedBefore);

    @Query("""
            select d from KbDocument d
             where (d.updatedAt > :since or (d.updatedAt = :since and d.id > :afterId))
               and d.updatedAt <= :horizon
             order by d.updatedAt asc, d.id asc
            """)
    List<KbDocument> findChangesAfter(@Param("since") Instant since, @Param("afterId") long afterId,
                                      @Param("horizon") Instant horizon, Pageable pageable);

    /**
     * 认领：仅当文档仍处于 needs_local 且排队令牌匹配时才成功，返回受影响行数
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update KbDocument d
               set d.processingStatus = :to, d.claimToken = :leaseToken, d.claimedAt = :now,
                   d.updatedAt = :now, d.version = d.version + 1
             where d.id = :id and d.processingStatus = :from and d.claimToken = :claimToken
            """)
    int transitionClaim(@Param("id") Long id,
                        @Param("claimToken") String claimToken,
                        @Param("leaseToken") String leaseToken,
                        @Param("now") Instant now,
                        @Param("from") ProcessingStatus from,
                        @Param("to") ProcessingStatus to);

    /**
     * 释放租约：文档回到 needs_local，尝试次数恰好加一，并换发新的排队令牌
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update KbDocument d
               set d.processingStatus = :to, d.claimToken = :queueToken, d.claimedAt = null,
                   d.attemptCount = d.attemptCount + 1, d.errorMessage = :reason,
                   d.updatedAt = :now, d.version = d.version + 1
             where d.id = :id and d.processingStatus = :from and d.claimToken = :leaseToken
            """)
    int transitionRelease(@Param("id") Long id,
                          @Param("leaseToken") String leaseToken,
                          @Param("queueToken") String queueToken,
                          @Param("reason") String reason,
                          @Param("now") Instant now,
                          @Param("from") ProcessingStatus from,
                          @Param("to") ProcessingStatus to);

    default int claim(Long id, String claimToken, String leaseToken, Instant now) {
        return transitionClaim(id, claimToken, leaseToken, now, ProcessingStatus.NEEDS_LOCAL, ProcessingStatus.PROCESSING);
    }

    default int release(Long id, String leaseToken, String queueToken, String reason, Instant now) {
        return transitionRelease(id, leaseToken, queueToken, reason, now, ProcessingStatus.PROCESSING, ProcessingStatus.NEEDS_LOCAL);
    }

    @Query("select d.processingStatus as groupKey, count(d) as total from KbDocument d group by d.processingStatus")
    List<GroupCount> countByStatus();

    @Query("select d.processingMode as groupKey, count(d) as total from KbDocument d where d.processingMode is not null group by d.processingMode")
    List<GroupCount> countByMode();

    long countByNeedsFullProcessingTrue();

    interface GroupCount {
        Object getGroupKey();

        long getTotal();
    }
}
