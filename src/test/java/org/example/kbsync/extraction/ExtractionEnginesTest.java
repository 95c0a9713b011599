package org.example.kbsync.extraction;

import org.example.kbsync.config.DeploymentProperties;
import org.example.kbsync.support.TestDocuments;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionEnginesTest {

    private final PlainTextExtractionEngine plainText = new PlainTextExtractionEngine();
    private final PdfTextLayerExtractionEngine pdfTextLayer = new PdfTextLayerExtractionEngine();

    private TikaFullExtractionEngine tikaFull() {
        DeploymentProperties properties = new DeploymentProperties();
        properties.setOcrEnabled(false);
        return new TikaFullExtractionEngine(properties);
    }

    @Test
    void plainTextStripsUtf8Bom() throws Exception {
        byte[] body = "山体滑坡预警".getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[body.length + 3];
        data[0] = (byte) 0xEF;
        data[1] = (byte) 0xBB;
        data[2] = (byte) 0xBF;
        System.arraycopy(body, 0, data, 3, body.length);

        ExtractionResult result = plainText.extract("alert.txt", data);

        assertThat(result.getContent()).isEqualTo("山体滑坡预警");
        assertThat(result.getMetadata()).containsEntry("encoding", "UTF-8");
    }

    @Test
    void plainTextFallsBackToLegacyEncoding() throws Exception {
        byte[] data = "café – flood".getBytes(Charset.forName("windows-1252"));

        ExtractionResult result = plainText.extract("legacy.txt", data);

        assertThat(result.getContent()).isEqualTo("café – flood");
        assertThat(result.getMetadata()).containsEntry("encoding", "windows-1252");
    }

    @Test
    void bytesUnmappedInWindows1252FallBackToIso88591() throws Exception {
        // 0x81 在 windows-1252 中没有定义
        byte[] data = {'r', 'o', 'a', 'd', ' ', (byte) 0x81, ' ', (byte) 0xE9};

        ExtractionResult result = plainText.extract("odd.txt", data);

        assertThat(result.getContent()).isEqualTo("road \u0081 é");
        assertThat(result.getMetadata()).containsEntry("encoding", "ISO-8859-1");
    }

    @Test
    void pdfTextLayerReadsEveryPage() throws Exception {
        ExtractionResult result = pdfTextLayer.extract("report.pdf", TestDocuments.textPdf(2));

        assertThat(result.getContent()).contains("Landslide warning");
        assertThat(result.getMetadata()).containsEntry("page_count", 2);
    }

    @Test
    void tikaExtractsDocx() throws Exception {
        byte[] docx = TestDocuments.docx("Evacuation route A", "Shelter at the school gym");

        ExtractionResult result = tikaFull().extract("plan.docx", docx);

        assertThat(result.getContent()).contains("Evacuation route A").contains("Shelter at the school gym");
        assertThat(result.getMetadata()).containsEntry("processor", TikaFullExtractionEngine.NAME);
    }

    @Test
    void tikaExtractsHtmlBody() throws Exception {
        byte[] html = "<html><head><title>t</title></head><body><p>Bridge closed</p></body></html>"
                .getBytes(StandardCharsets.UTF_8);

        assertThat(tikaFull().extract("notice.html", html).getContent()).contains("Bridge closed");
    }

    @Test
    void tikaWithoutOcrCannotReadScannedPdf() throws Exception {
        byte[] scanned = TestDocuments.blankPdf(1);

        assertThatThrownBy(() -> tikaFull().extract("scan.pdf", scanned))
                .isInstanceOf(ExtractionException.class);
    }
}
