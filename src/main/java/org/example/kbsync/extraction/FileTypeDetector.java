package org.example.kbsync.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 根据扩展名判断文件类型；PDF 需要读取文本层才能区分文本型与扫描件。
 * 这是策略选择中唯一需要 I/O 的一步。
 */
@Slf4j
@Component
public class FileTypeDetector {

    public FileType detect(String filename, byte[] data) throws ExtractionException {
        String extension = FileType.extensionOf(filename);
        if (!FileType.PDF_EXTENSION.equals(extension)) {
            return FileType.fromExtension(extension);
        }
        try {
            PdfTextLayer layer = PdfTextLayer.read(data);
            FileType type = layer.looksScanned() ? FileType.PDF_SCANNED : FileType.PDF_TEXT;
            log.debug("PDF 文本层检测: {} 页数={} 有文本页数={} -> {}",
                    filename, layer.getPageCount(), layer.getPagesWithText(), type);
            return type;
        } catch (IOException e) {
            throw new ExtractionException("无法解析的 PDF 文件: " + e.getMessage(), e);
        }
    }
}
