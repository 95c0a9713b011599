package org.example.kbsync.utils;

import lombok.Value;
import org.example.kbsync.entity.dto.RecordKind;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * 变更流游标：(updatedAt, kind, id) 三元组，对应变更流的排序键。
 * 下一页从严格大于该三元组的位置继续，保证并发写入时不重不漏。
 */
@Value
public class ChangeCursor {

    Instant updatedAt;
    RecordKind kind;
    long id;

    /**
     * 只给出 since 时间戳的起始游标，排在该时刻所有记录之后
     */
    public static ChangeCursor since(Instant since) {
        return new ChangeCursor(since, RecordKind.last(), Long.MAX_VALUE);
    }

    public String encode() {
        String raw = updatedAt.toString() + "|" + kind.getValue() + "|" + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static ChangeCursor decode(String token) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
            String[] parts = raw.split("\\|");
            if (parts.length != 3) {
                throw new IllegalArgumentException("游标格式错误: " + token);
            }
            return new ChangeCursor(Instant.parse(parts[0]), RecordKind.fromValue(parts[1]), Long.parseLong(parts[2]));
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new IllegalArgumentException("游标格式错误: " + token, e);
        }
    }

    /**
     * 游标是否排在给定记录之前，即该记录应出现在下一页
     */
    public boolean precedes(Instant recordUpdatedAt, RecordKind recordKind, long recordId) {
        int byTime = recordUpdatedAt.compareTo(updatedAt);
        if (byTime != 0) {
            return byTime > 0;
        }
        int byKind = Integer.compare(recordKind.getOrder(), kind.getOrder());
        if (byKind != 0) {
            return byKind > 0;
        }
        return recordId > id;
    }
}
