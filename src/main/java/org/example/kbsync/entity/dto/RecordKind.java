package org.example.kbsync.entity.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

/**
 * 变更流中的记录类型，order 参与排序（同一 updatedAt 下先 document 后 knowledge_entry）
 */
@Getter
public enum RecordKind {

    DOCUMENT("document", 0),
    KNOWLEDGE_ENTRY("knowledge_entry", 1);

    @JsonValue
    private final String value;
    private final int order;

    RecordKind(String value, int order) {
        this.value = value;
        this.order = order;
    }

    public static RecordKind fromValue(String value) {
        return Arrays.stream(values())
                .filter(k -> k.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的记录类型: " + value));
    }

    public static RecordKind last() {
        return KNOWLEDGE_ENTRY;
    }
}
