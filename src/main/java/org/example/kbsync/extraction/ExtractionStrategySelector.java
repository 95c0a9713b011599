package org.example.kbsync.extraction;

import lombok.RequiredArgsConstructor;
import org.example.kbsync.entity.InstanceTier;
import org.springframework.stereotype.Component;

/**
 * 根据文件类型与实例能力等级选择上传时同步运行的抽取引擎。
 * 纯函数：不做 I/O，相同输入总是得到相同结果。
 */
@Component
@RequiredArgsConstructor
public class ExtractionStrategySelector {

    private final ExtractionEngineRegistry registry;

    public ExtractionStrategy select(FileType fileType, InstanceTier tier) throws UnsupportedFileTypeException {
        if (fileType == null || fileType == FileType.UNKNOWN) {
            throw new UnsupportedFileTypeException(fileType == null ? null : fileType.name().toLowerCase());
        }
        return registry.lookup(fileType, tier)
                .orElseThrow(() -> new UnsupportedFileTypeException(fileType.name().toLowerCase()));
    }
}
