package org.example.kbsync.extraction;

import org.example.kbsync.support.TestDocuments;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileTypeDetectorTest {

    private final FileTypeDetector detector = new FileTypeDetector();

    @Test
    void detectsByExtension() throws Exception {
        assertThat(detector.detect("notes.TXT", new byte[0])).isEqualTo(FileType.TEXT);
        assertThat(detector.detect("readme.md", new byte[0])).isEqualTo(FileType.MARKDOWN);
        assertThat(detector.detect("report.docx", new byte[0])).isEqualTo(FileType.DOCX);
        assertThat(detector.detect("slides.pptx", new byte[0])).isEqualTo(FileType.PPTX);
        assertThat(detector.detect("sheet.xls", new byte[0])).isEqualTo(FileType.XLSX);
        assertThat(detector.detect("page.htm", new byte[0])).isEqualTo(FileType.HTML);
        assertThat(detector.detect("archive.zip", new byte[0])).isEqualTo(FileType.UNKNOWN);
        assertThat(detector.detect("no-extension", new byte[0])).isEqualTo(FileType.UNKNOWN);
    }

    @Test
    void pdfWithTextLayerIsTextPdf() throws Exception {
        assertThat(detector.detect("report.pdf", TestDocuments.textPdf(2))).isEqualTo(FileType.PDF_TEXT);
    }

    @Test
    void pdfWithoutTextLayerIsScanned() throws Exception {
        assertThat(detector.detect("scan.pdf", TestDocuments.blankPdf(3))).isEqualTo(FileType.PDF_SCANNED);
    }

    @Test
    void corruptPdfIsAnExtractionError() {
        byte[] garbage = "not a pdf".getBytes(StandardCharsets.UTF_8);
        assertThatThrownBy(() -> detector.detect("broken.pdf", garbage))
                .isInstanceOf(ExtractionException.class);
    }
}
