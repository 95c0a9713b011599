package org.example.kbsync.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

/**
 * 记录当前 content 由哪种引擎产生
 */
@Getter
public enum ProcessingMode {

    CLOUD_BASIC("cloud_basic", 1),
    LOCAL_FULL("local_full", 2);

    @JsonValue
    private final String value;
    private final int strength;

    ProcessingMode(String value, int strength) {
        this.value = value;
        this.strength = strength;
    }

    /**
     * local_full 强于 cloud_basic，较弱的结果不能覆盖较强的结果
     */
    public boolean isWeakerThan(ProcessingMode other) {
        return other != null && strength < other.strength;
    }
}
