package org.example.kbsync.extraction;

import lombok.Value;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;

/**
 * PDF 文本层的读取结果
 */
@Value
public class PdfTextLayer {

    // 少于 10% 的页面有文本，或全文不足 100 个字符，视为扫描件
    static final double MIN_TEXT_COVERAGE = 0.1;
    static final int MIN_TEXT_LENGTH = 100;

    String text;
    int pageCount;
    int pagesWithText;

    public static PdfTextLayer read(byte[] data) throws IOException {
        try (PDDocument document = PDDocument.load(data)) {
            PDFTextStripper stripper = new PDFTextStripper();
            int pageCount = document.getNumberOfPages();
            int pagesWithText = 0;
            StringBuilder text = new StringBuilder();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(document);
                if (!pageText.isBlank()) {
                    pagesWithText++;
                }
                if (page > 1) {
                    text.append("\n\n");
                }
                text.append(pageText);
            }
            return new PdfTextLayer(text.toString(), pageCount, pagesWithText);
        }
    }

    public double textCoverage() {
        return pageCount > 0 ? (double) pagesWithText / pageCount : 0;
    }

    public boolean looksScanned() {
        return textCoverage() < MIN_TEXT_COVERAGE || text.strip().length() < MIN_TEXT_LENGTH;
    }
}
