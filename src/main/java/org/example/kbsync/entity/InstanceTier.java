package org.example.kbsync.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 实例的能力等级：cloud 只有基础抽取能力，local 具备 OCR 与 Office 转换等完整能力。
 * 同时用于标记最后写入权威内容的一侧。
 */
@Getter
public enum InstanceTier {

    CLOUD("cloud"),
    LOCAL("local");

    @JsonValue
    private final String value;

    InstanceTier(String value) {
        this.value = value;
    }
}
