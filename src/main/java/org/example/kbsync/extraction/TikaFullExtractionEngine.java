package org.example.kbsync.extraction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.parser.ocr.TesseractOCRConfig;
import org.apache.tika.parser.pdf.PDFParserConfig;
import org.apache.tika.sax.BodyContentHandler;
import org.example.kbsync.config.DeploymentProperties;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * 完整抽取：Office / HTML 结构化转换，扫描件 PDF 走 Tesseract OCR。
 * 只在 local 实例上注册。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TikaFullExtractionEngine implements ExtractionEngine {

    public static final String NAME = "tika-full";

    private final DeploymentProperties deploymentProperties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExtractionResult extract(String filename, byte[] data) throws ExtractionException {
        String content;
        Metadata metadata = new Metadata();
        try (InputStream stream = new ByteArrayInputStream(data)) {
            BodyContentHandler bodyContentHandler = new BodyContentHandler(-1);
            Parser parser = new AutoDetectParser();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
            parser.parse(stream, bodyContentHandler, metadata, buildContext());
            content = bodyContentHandler.toString();
        } catch (IOException | SAXException | TikaException e) {
            throw new ExtractionException("完整抽取失败: " + e.getMessage(), e);
        }
        // 简单的清洗 (去掉多余空行)
        content = content.replaceAll("\\n{3,}", "\n\n").strip();
        if (content.isEmpty()) {
            throw new ExtractionException("未能从文件中抽取到任何文本: " + filename);
        }
        Map<String, Object> result = new HashMap<>();
        result.put("processor", NAME);
        result.put("content_type", metadata.get(Metadata.CONTENT_TYPE));
        result.put("character_count", content.length());
        result.put("file_size", data.length);
        result.put("ocr_enabled", deploymentProperties.isOcrEnabled());
        String pages = metadata.get("xmpTPg:NPages");
        if (pages != null) {
            result.put("page_count", Integer.parseInt(pages));
        }
        log.debug("完整抽取完成: {} 字符数={}", filename, content.length());
        return new ExtractionResult(content, result);
    }

    private ParseContext buildContext() {
        ParseContext context = new ParseContext();
        TesseractOCRConfig ocrConfig = new TesseractOCRConfig();
        if (deploymentProperties.isOcrEnabled()) {
            ocrConfig.setLanguage(deploymentProperties.getOcrLanguage());
            PDFParserConfig pdfConfig = new PDFParserConfig();
            pdfConfig.setOcrStrategy(PDFParserConfig.OCR_STRATEGY.OCR_AND_TEXT_EXTRACTION);
            pdfConfig.setExtractInlineImages(false);
            context.set(PDFParserConfig.class, pdfConfig);
        } else {
            ocrConfig.setSkipOcr(true);
        }
        context.set(TesseractOCRConfig.class, ocrConfig);
        return context;
    }
}
