package org.example.kbsync.extraction;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.entity.InstanceTier;
import org.springframework.stereotype.Component;

/**
 * 检测类型、选择策略、运行引擎。上传流程与 local 同步 worker 共用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionPipeline {

    private final FileTypeDetector fileTypeDetector;
    private final ExtractionStrategySelector strategySelector;

    public Outcome run(String filename, byte[] data, InstanceTier tier) throws ExtractionException {
        FileType fileType = fileTypeDetector.detect(filename, data);
        if (fileType == FileType.UNKNOWN) {
            throw new UnsupportedFileTypeException(FileType.extensionOf(filename));
        }
        ExtractionStrategy strategy = strategySelector.select(fileType, tier);
        if (!strategy.hasEngine()) {
            log.info("{} 在 {} 实例上无可用引擎，等待 local 处理", filename, tier.getValue());
            return new Outcome(strategy, null);
        }
        long start = System.currentTimeMillis();
        ExtractionResult result = strategy.getEngine().extract(filename, data);
        log.info("抽取完成: {} 引擎={} 字符数={} 耗时={}ms", filename, strategy.getEngine().name(),
                result.getContent().length(), System.currentTimeMillis() - start);
        if (strategy.isFinal() && result.getContent().isBlank()) {
            throw new ExtractionException("未能从文件中抽取到文本: " + filename);
        }
        return new Outcome(strategy, result);
    }

    @Value
    public static class Outcome {
        ExtractionStrategy strategy;
        // 无引擎时为空
        ExtractionResult result;

        public boolean isFinal() {
            return strategy.isFinal();
        }
    }
}
