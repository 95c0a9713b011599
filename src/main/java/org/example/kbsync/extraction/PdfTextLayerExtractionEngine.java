package org.example.kbsync.extraction;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * 只读取 PDF 自带的文本层，不做 OCR。扫描件只能得到部分文本。
 */
@Component
public class PdfTextLayerExtractionEngine implements ExtractionEngine {

    public static final String NAME = "pdf-text-layer";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExtractionResult extract(String filename, byte[] data) throws ExtractionException {
        try {
            PdfTextLayer layer = PdfTextLayer.read(data);
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("processor", NAME);
            metadata.put("page_count", layer.getPageCount());
            metadata.put("pages_with_text", layer.getPagesWithText());
            metadata.put("text_coverage", layer.textCoverage());
            metadata.put("character_count", layer.getText().length());
            metadata.put("file_size", data.length);
            return new ExtractionResult(layer.getText(), metadata);
        } catch (IOException e) {
            throw new ExtractionException("PDF 文本抽取失败: " + e.getMessage(), e);
        }
    }
}
