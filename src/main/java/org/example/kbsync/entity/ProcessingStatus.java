package org.example.kbsync.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 文档处理状态，任意时刻只有一个成立
 */
@Getter
public enum ProcessingStatus {

    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    NEEDS_LOCAL("needs_local"),
    FAILED("failed");

    @JsonValue
    private final String value;

    ProcessingStatus(String value) {
        this.value = value;
    }

    /**
     * completed 与 failed 为终态，除非外部重新提交，否则不会再自动迁移
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
