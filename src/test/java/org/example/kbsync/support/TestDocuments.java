package org.example.kbsync.support;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * 在测试中现场生成的样例文件
 */
public final class TestDocuments {

    public static final String PDF_SENTENCE =
            "Landslide warning for the northern slope after three days of heavy rain in the valley.";

    private TestDocuments() {
    }

    public static byte[] docx(String... paragraphs) throws IOException {
        try (XWPFDocument document = new XWPFDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String paragraph : paragraphs) {
                document.createParagraph().createRun().setText(paragraph);
            }
            document.write(out);
            return out.toByteArray();
        }
    }

    /**
     * 每页写几行文字，带文本层
     */
    public static byte[] textPdf(int pages) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (int i = 0; i < pages; i++) {
                PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    stream.beginText();
                    stream.setFont(PDType1Font.HELVETICA, 12);
                    stream.newLineAtOffset(50, 700);
                    for (int line = 0; line < 3; line++) {
                        stream.showText(PDF_SENTENCE);
                        stream.newLineAtOffset(0, -16);
                    }
                    stream.endText();
                }
            }
            document.save(out);
            return out.toByteArray();
        }
    }

    /**
     * 只有空白页，没有文本层，相当于扫描件
     */
    public static byte[] blankPdf(int pages) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (int i = 0; i < pages; i++) {
                document.addPage(new PDPage());
            }
            document.save(out);
            return out.toByteArray();
        }
    }
}
