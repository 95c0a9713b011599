package org.example.kbsync.service;

import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.KnowledgeEntry;
import org.example.kbsync.entity.dto.ChangeRecord;
import org.example.kbsync.entity.dto.RecordKind;
import org.example.kbsync.repository.KnowledgeEntryRepository;
import org.example.kbsync.utils.Timestamps;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 把从 cloud 拉取的知识条目写入本地副本，按 (cloud, 原始 id) 去重更新。
 * 文档记录由 cloud 统一管理，本地只跳过。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PulledChangeApplier {

    private final KnowledgeEntryRepository knowledgeEntryRepository;
    private final Clock clock;

    /**
     * @return 写入的知识条目数
     */
    @Transactional
    public int apply(List<ChangeRecord> records) {
        int applied = 0;
        for (ChangeRecord record : records) {
            if (record.getKind() != RecordKind.KNOWLEDGE_ENTRY) {
                continue;
            }
            upsert(record);
            applied++;
        }
        return applied;
    }

    private void upsert(ChangeRecord record) {
        Map<String, Object> data = record.getData() == null ? Map.of() : record.getData();
        KnowledgeEntry entry = knowledgeEntryRepository
                .findBySourceInstanceAndOriginId(InstanceTier.CLOUD, record.getId())
                .orElseGet(() -> {
                    KnowledgeEntry created = new KnowledgeEntry();
                    created.setSourceInstance(InstanceTier.CLOUD);
                    created.setOriginId(record.getId());
                    created.setCreatedAt(createdAtOf(data));
                    return created;
                });
        entry.setTitle(Objects.requireNonNullElse(text(data, "title"), ""));
        entry.setDescription(Objects.requireNonNullElse(text(data, "description"), ""));
        entry.setTags(text(data, "tags"));
        entry.setLocation(text(data, "location"));
        entry.setHazardType(text(data, "hazardType"));
        entry.setSource(text(data, "source"));
        entry.setUpdatedAt(Timestamps.next(clock, entry.getUpdatedAt()));
        knowledgeEntryRepository.save(entry);
        log.debug("已同步知识条目，cloud ID={}", record.getId());
    }

    private Instant createdAtOf(Map<String, Object> data) {
        Object createdAt = data.get("createdAt");
        return createdAt == null ? Timestamps.now(clock) : Instant.parse(createdAt.toString());
    }

    private static String text(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value == null ? null : value.toString();
    }
}
