package org.example.kbsync.entity.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum SubmitOutcome {

    // 结果已写入，文档 completed
    APPLIED("applied"),
    // 同一 (documentId, contentHash) 已经写入过
    DUPLICATE("duplicate"),
    // 本地抽取失败，文档 failed
    FAILED("failed"),
    // 校验未通过，文档回到 needs_local 等待重试
    REQUEUED("requeued");

    @JsonValue
    private final String value;

    SubmitOutcome(String value) {
        this.value = value;
    }

    public boolean isAccepted() {
        return this == APPLIED || this == DUPLICATE;
    }
}
