package org.example.kbsync.extraction;

import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.ProcessingMode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * (文件类型, 能力等级) 到抽取策略的登记表
 */
@Component
public class ExtractionEngineRegistry {

    private final Map<InstanceTier, Map<FileType, ExtractionStrategy>> strategies = new EnumMap<>(InstanceTier.class);

    public ExtractionEngineRegistry(PlainTextExtractionEngine plainText,
                                    PdfTextLayerExtractionEngine pdfTextLayer,
                                    TikaFullExtractionEngine tikaFull) {
        // cloud：文本类直接定稿，扫描件保留部分文本后排队，Office/HTML 无引擎直接排队
        register(InstanceTier.CLOUD, FileType.TEXT, plainText, true, ProcessingMode.CLOUD_BASIC);
        register(InstanceTier.CLOUD, FileType.MARKDOWN, plainText, true, ProcessingMode.CLOUD_BASIC);
        register(InstanceTier.CLOUD, FileType.PDF_TEXT, pdfTextLayer, true, ProcessingMode.CLOUD_BASIC);
        register(InstanceTier.CLOUD, FileType.PDF_SCANNED, pdfTextLayer, false, ProcessingMode.CLOUD_BASIC);
        for (FileType deferred : List.of(FileType.DOCX, FileType.PPTX, FileType.XLSX, FileType.HTML)) {
            register(InstanceTier.CLOUD, deferred, null, false, null);
        }

        // local：全部定稿
        register(InstanceTier.LOCAL, FileType.TEXT, plainText, true, ProcessingMode.LOCAL_FULL);
        register(InstanceTier.LOCAL, FileType.MARKDOWN, plainText, true, ProcessingMode.LOCAL_FULL);
        register(InstanceTier.LOCAL, FileType.PDF_TEXT, pdfTextLayer, true, ProcessingMode.LOCAL_FULL);
        for (FileType full : List.of(FileType.PDF_SCANNED, FileType.DOCX, FileType.PPTX, FileType.XLSX, FileType.HTML)) {
            register(InstanceTier.LOCAL, full, tikaFull, true, ProcessingMode.LOCAL_FULL);
        }
    }

    private void register(InstanceTier tier, FileType type, ExtractionEngine engine, boolean isFinal, ProcessingMode mode) {
        strategies.computeIfAbsent(tier, t -> new EnumMap<>(FileType.class))
                .put(type, new ExtractionStrategy(type, tier, engine, isFinal, mode));
    }

    public Optional<ExtractionStrategy> lookup(FileType type, InstanceTier tier) {
        return Optional.ofNullable(strategies.getOrDefault(tier, Map.of()).get(type));
    }

    /**
     * 在该等级上能直接定稿的扩展名
     */
    public List<String> finalFormats(InstanceTier tier) {
        return formats(tier, true);
    }

    public List<String> deferredFormats(InstanceTier tier) {
        return formats(tier, false);
    }

    private List<String> formats(InstanceTier tier, boolean isFinal) {
        TreeSet<String> extensions = new TreeSet<>();
        strategies.getOrDefault(tier, Map.of()).values().stream()
                .filter(s -> s.isFinal() == isFinal)
                .forEach(s -> extensions.addAll(s.getFileType().getExtensions()));
        // 文本型 PDF 能定稿时，pdf 不算作只能排队的格式
        if (!isFinal && lookup(FileType.PDF_TEXT, tier).map(ExtractionStrategy::isFinal).orElse(false)) {
            extensions.remove(FileType.PDF_EXTENSION);
        }
        return List.copyOf(extensions);
    }
}
