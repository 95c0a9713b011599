package org.example.kbsync.extraction;

import lombok.Value;
import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.ProcessingMode;

/**
 * 选择结果：在上传时同步运行哪个引擎，以及结果是否为最终结果。
 * engine 为空表示本实例无法抽取，只能排队等 local 实例处理。
 */
@Value
public class ExtractionStrategy {
    FileType fileType;
    InstanceTier tier;
    ExtractionEngine engine;
    boolean isFinal;
    ProcessingMode mode;

    public boolean hasEngine() {
        return engine != null;
    }
}
