package org.example.kbsync.service;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.KnowledgeEntry;
import org.example.kbsync.entity.dto.ChangeRecord;
import org.example.kbsync.entity.dto.RecordKind;
import org.example.kbsync.repository.KbDocumentRepository;
import org.example.kbsync.repository.KnowledgeEntryRepository;
import org.example.kbsync.utils.ChangeCursor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 文档与知识条目合并后的变更流，按 (updatedAt, kind, id) 排序。
 * 两张表各取 limit+1 条再归并，结果与单表排序分页一致。
 * <p>
 * updatedAt 在事务内取值、提交时才可见，提交顺序可能与时间戳顺序不同。
 * 每次只读 updatedAt 不晚于 horizon 的行，horizon 之前的写事务都已提交，
 * 游标因此不会越过尚未可见的行。
 */
@Component
@RequiredArgsConstructor
public class ChangeFeedService {

    private static final Comparator<ChangeRecord> FEED_ORDER = Comparator
            .comparing(ChangeRecord::getUpdatedAt)
            .thenComparingInt((ChangeRecord r) -> r.getKind().getOrder())
            .thenComparingLong(ChangeRecord::getId);

    private final KbDocumentRepository kbDocumentRepository;
    private final KnowledgeEntryRepository knowledgeEntryRepository;

    public Page read(ChangeCursor cursor, int limit, Instant horizon) {
        PageRequest fetch = PageRequest.of(0, limit + 1);
        List<ChangeRecord> merged = new ArrayList<>();
        kbDocumentRepository.findChangesAfter(cursor.getUpdatedAt(), afterId(RecordKind.DOCUMENT, cursor),
                        horizon, fetch)
                .forEach(doc -> merged.add(toRecord(doc)));
        knowledgeEntryRepository.findChangesAfter(cursor.getUpdatedAt(), afterId(RecordKind.KNOWLEDGE_ENTRY, cursor),
                        horizon, fetch)
                .forEach(entry -> merged.add(toRecord(entry)));
        merged.removeIf(r -> !cursor.precedes(r.getUpdatedAt(), r.getKind(), r.getId()));
        merged.sort(FEED_ORDER);

        boolean hasMore = merged.size() > limit;
        List<ChangeRecord> records = hasMore ? List.copyOf(merged.subList(0, limit)) : List.copyOf(merged);
        ChangeCursor next = records.isEmpty()
                ? cursor
                : cursorAt(records.get(records.size() - 1));
        return new Page(records, next, hasMore);
    }

    /**
     * 同一时刻内，排在游标类型之前的表已经读完，之后的表从头读，同类型的表从游标 id 之后读
     */
    static long afterId(RecordKind tableKind, ChangeCursor cursor) {
        int order = Integer.compare(tableKind.getOrder(), cursor.getKind().getOrder());
        if (order < 0) {
            return Long.MAX_VALUE;
        }
        return order == 0 ? cursor.getId() : -1L;
    }

    private static ChangeCursor cursorAt(ChangeRecord record) {
        return new ChangeCursor(record.getUpdatedAt(), record.getKind(), record.getId());
    }

    private static ChangeRecord toRecord(KbDocument doc) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("title", doc.getTitle());
        data.put("filename", doc.getFilename());
        data.put("description", doc.getDescription());
        data.put("tags", doc.getTags());
        data.put("location", doc.getLocation());
        data.put("hazardType", doc.getHazardType());
        data.put("source", doc.getSource());
        data.put("processingStatus", doc.getProcessingStatus().getValue());
        data.put("processingMode", doc.getProcessingMode() == null ? null : doc.getProcessingMode().getValue());
        data.put("needsFullProcessing", doc.isNeedsFullProcessing());
        data.put("contentHash", doc.getContentHash());
        data.put("sourceInstance", doc.getSourceInstance() == null ? null : doc.getSourceInstance().getValue());
        data.put("createdAt", doc.getCreatedAt().toString());
        return new ChangeRecord(RecordKind.DOCUMENT, doc.getId(), doc.getUpdatedAt(), data);
    }

    private static ChangeRecord toRecord(KnowledgeEntry entry) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("title", entry.getTitle());
        data.put("description", entry.getDescription());
        data.put("tags", entry.getTags());
        data.put("location", entry.getLocation());
        data.put("hazardType", entry.getHazardType());
        data.put("source", entry.getSource());
        data.put("createdAt", entry.getCreatedAt().toString());
        return new ChangeRecord(RecordKind.KNOWLEDGE_ENTRY, entry.getId(), entry.getUpdatedAt(), data);
    }

    @Value
    public static class Page {
        List<ChangeRecord> records;
        ChangeCursor next;
        boolean hasMore;
    }
}
