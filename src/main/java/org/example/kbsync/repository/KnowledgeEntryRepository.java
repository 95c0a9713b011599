package org.example.kbsync.repository;

import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.KnowledgeEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface KnowledgeEntryRepository extends JpaRepository<KnowledgeEntry, Long> {

    @Query("""
            select k from KnowledgeEntry k
             where (k.updatedAt > :since or (k.updatedAt = :since and k.id > :afterId))
               and k.updatedAt <= :horizon
             order by k.updatedAt asc, k.id asc
            """)
    List<KnowledgeEntry> findChangesAfter(@Param("since") Instant since, @Param("afterId") long afterId,
                                          @Param("horizon") Instant horizon, Pageable pageable);

    Optional<KnowledgeEntry> findBySourceInstanceAndOriginId(InstanceTier sourceInstance, Long originId);
}
