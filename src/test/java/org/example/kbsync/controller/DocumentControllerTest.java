package org.example.kbsync.controller;

import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.ProcessingMode;
import org.example.kbsync.entity.ProcessingStatus;
import org.example.kbsync.support.IntegrationTestSupport;
import org.example.kbsync.support.TestDocuments;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DocumentControllerTest extends IntegrationTestSupport {

    @Value("${kb.storage.local-dir}")
    private String localDir;

    @Test
    void plainTextIsFinalizedOnCloud() throws Exception {
        Long id = upload("report.txt", "Road 12 flooded near the bridge.\r\n");

        KbDocument doc = reload(id);
        assertThat(doc.getProcessingStatus()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(doc.getProcessingMode()).isEqualTo(ProcessingMode.CLOUD_BASIC);
        assertThat(doc.getSourceInstance()).isEqualTo(InstanceTier.CLOUD);
        assertThat(doc.isNeedsFullProcessing()).isFalse();
        assertThat(doc.getContent()).isEqualTo("Road 12 flooded near the bridge.");
        assertThat(doc.getProcessedAt()).isNotNull();
        verify(documentEventPublisher).publishProcessed(any(KbDocument.class));

        mockMvc.perform(withKey(get("/api/sync/documents/unprocessed")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.items").isEmpty());
    }

    @Test
    void uploadResponseCarriesStatusAndMetadata() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "alert.md", "text/markdown", "# Alert".getBytes());

        mockMvc.perform(multipart("/api/documents/upload").file(file)
                        .param("title", "Flood alert")
                        .param("hazardType", "flood")
                        .param("location", "North valley"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.title").value("Flood alert"))
                .andExpect(jsonPath("$.data.processingStatus").value("completed"))
                .andExpect(jsonPath("$.data.processingMode").value("cloud_basic"));

        KbDocument doc = kbDocumentRepository.findAll().get(0);
        assertThat(doc.getHazardType()).isEqualTo("flood");
        assertThat(doc.getLocation()).isEqualTo("North valley");
        assertThat(doc.getFileExtension()).isEqualTo("md");
    }

    @Test
    void textPdfIsFinalizedOnCloud() throws Exception {
        Long id = upload("report.pdf", TestDocuments.textPdf(1));

        KbDocument doc = reload(id);
        assertThat(doc.getProcessingStatus()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(doc.getProcessingMode()).isEqualTo(ProcessingMode.CLOUD_BASIC);
        assertThat(doc.getContent()).contains("Landslide warning");
    }

    @Test
    void officeDocumentIsQueuedForLocalProcessing() throws Exception {
        Long id = upload("plan.docx", TestDocuments.docx("Evacuation plan"));

        KbDocument doc = reload(id);
        assertThat(doc.getProcessingStatus()).isEqualTo(ProcessingStatus.NEEDS_LOCAL);
        assertThat(doc.isNeedsFullProcessing()).isTrue();
        assertThat(doc.getProcessingMode()).isNull();
        assertThat(doc.getContent()).isNull();
        assertThat(doc.getClaimToken()).isNotBlank();
        verify(documentEventPublisher, never()).publishProcessed(any());

        mockMvc.perform(withKey(get("/api/sync/documents/unprocessed")))
                .andExpect(jsonPath("$.data.items[0].id").value(id))
                .andExpect(jsonPath("$.data.items[0].filename").value("plan.docx"));
    }

    @Test
    void scannedPdfIsQueuedForLocalProcessing() throws Exception {
        Long id = upload("scan.pdf", TestDocuments.blankPdf(2));

        KbDocument doc = reload(id);
        assertThat(doc.getProcessingStatus()).isEqualTo(ProcessingStatus.NEEDS_LOCAL);
        assertThat(doc.isNeedsFullProcessing()).isTrue();
    }

    @Test
    void unknownTypeFailsWithReason() throws Exception {
        Long id = upload("archive.zip", new byte[]{1, 2, 3});

        KbDocument doc = reload(id);
        assertThat(doc.getProcessingStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(doc.getErrorMessage()).contains("zip");
        assertThat(doc.isNeedsFullProcessing()).isFalse();
    }

    @Test
    void emptyTextFileFails() throws Exception {
        Long id = upload("blank.txt", "   \n  ");

        assertThat(reload(id).getProcessingStatus()).isEqualTo(ProcessingStatus.FAILED);
    }

    @Test
    void oversizedUploadIsRejected() throws Exception {
        byte[] large = new byte[1024 * 1024 + 1];
        MockMultipartFile file = new MockMultipartFile("file", "big.txt", "text/plain", large);

        mockMvc.perform(multipart("/api/documents/upload").file(file))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.code").value(413));

        assertThat(kbDocumentRepository.count()).isZero();
    }

    @Test
    void failedRegistrationRemovesStoredFile() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", "flood notes".getBytes());
        long storedBefore = storedFileCount();

        //标题超过列宽，插入失败，整个上传事务回滚
        mockMvc.perform(multipart("/api/documents/upload").file(file).param("title", "t".repeat(300)))
                .andExpect(status().isInternalServerError());

        assertThat(kbDocumentRepository.count()).isZero();
        assertThat(storedFileCount()).isEqualTo(storedBefore);
    }

    @Test
    void statusOfMissingDocumentIsNotFound() throws Exception {
        mockMvc.perform(get("/api/documents/{id}/status", 9999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    void statusReportsProcessingState() throws Exception {
        Long id = upload("plan.docx", TestDocuments.docx("Evacuation plan"));

        mockMvc.perform(get("/api/documents/{id}/status", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.processingStatus").value("needs_local"))
                .andExpect(jsonPath("$.data.needsFullProcessing").value(true))
                .andExpect(jsonPath("$.data.attemptCount").value(0));
    }

    @Test
    void statsAggregateByStatusAndMode() throws Exception {
        upload("a.txt", "first");
        upload("b.txt", "second");
        upload("c.docx", TestDocuments.docx("third"));
        upload("d.zip", new byte[]{1});

        mockMvc.perform(get("/api/documents/processing/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(4))
                .andExpect(jsonPath("$.data.byStatus.completed").value(2))
                .andExpect(jsonPath("$.data.byStatus.needs_local").value(1))
                .andExpect(jsonPath("$.data.byStatus.failed").value(1))
                .andExpect(jsonPath("$.data.byStatus.pending").value(0))
                .andExpect(jsonPath("$.data.byMode.cloud_basic").value(2))
                .andExpect(jsonPath("$.data.needsFullProcessing").value(1))
                .andExpect(jsonPath("$.data.tier").value("cloud"));
    }

    @Test
    void reprocessRequeuesFailedDocumentThatNeedsFullProcessing() throws Exception {
        Long id = upload("plan.docx", TestDocuments.docx("Evacuation plan"));
        KbDocument doc = reload(id);
        doc.setProcessingStatus(ProcessingStatus.FAILED);
        doc.setAttemptCount(3);
        doc.setErrorMessage("超过最大重试次数");
        kbDocumentRepository.save(doc);

        mockMvc.perform(post("/api/documents/{id}/reprocess", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.processingStatus").value("needs_local"))
                .andExpect(jsonPath("$.data.attemptCount").value(0));
    }

    @Test
    void reprocessOfHealthyDocumentIsConflict() throws Exception {
        Long id = upload("a.txt", "fine");

        mockMvc.perform(post("/api/documents/{id}/reprocess", id))
                .andExpect(status().isConflict());
    }

    private long storedFileCount() throws IOException {
        Path uploads = Path.of(localDir, "uploads");
        if (!Files.isDirectory(uploads)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(uploads)) {
            return files.count();
        }
    }
}
