package org.example.kbsync.service;

import org.example.kbsync.common.IllegalStateTransitionException;
import org.example.kbsync.entity.InstanceTier;
import org.example.kbsync.entity.KbDocument;
import org.example.kbsync.entity.ProcessingMode;
import org.example.kbsync.entity.ProcessingStatus;
import org.example.kbsync.support.IntegrationTestSupport;
import org.example.kbsync.support.TestDocuments;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentStateMachineTest extends IntegrationTestSupport {

    @Autowired
    private DocumentStateMachine stateMachine;
    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    void updatedAtStrictlyIncreasesUnderFrozenClock() throws Exception {
        Long id = upload("plan.docx", TestDocuments.docx("Evacuation plan"));
        Instant before = reload(id).getUpdatedAt();

        String lease = claim(id).getClaimToken();
        Instant afterClaim = reload(id).getUpdatedAt();
        transactionTemplate.execute(status -> stateMachine.release(reload(id), lease, "retry"));
        Instant afterRelease = reload(id).getUpdatedAt();

        assertThat(afterClaim).isAfter(before);
        assertThat(afterRelease).isAfter(afterClaim);
    }

    @Test
    void releaseIncrementsAttemptsExactlyOnce() throws Exception {
        Long id = upload("plan.docx", TestDocuments.docx("Evacuation plan"));
        String lease = claim(id).getClaimToken();

        Optional<KbDocument> first = transactionTemplate.execute(status -> stateMachine.release(reload(id), lease, "timeout"));
        Optional<KbDocument> second = transactionTemplate.execute(status -> stateMachine.release(reload(id), lease, "timeout"));

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        KbDocument doc = reload(id);
        assertThat(doc.getAttemptCount()).isEqualTo(1);
        assertThat(doc.getProcessingStatus()).isEqualTo(ProcessingStatus.NEEDS_LOCAL);
        assertThat(doc.getClaimToken()).isNotEqualTo(lease);
        assertThat(doc.getErrorMessage()).isEqualTo("timeout");
    }

    @Test
    void lastAllowedReleaseFailsTheDocument() throws Exception {
        Long id = upload("plan.docx", TestDocuments.docx("Evacuation plan"));
        KbDocument doc = reload(id);
        doc.setAttemptCount(2);
        kbDocumentRepository.save(doc);
        String lease = claim(id).getClaimToken();

        transactionTemplate.execute(status -> stateMachine.release(reload(id), lease, "ocr crashed"));

        KbDocument failed = reload(id);
        assertThat(failed.getProcessingStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(failed.getAttemptCount()).isEqualTo(3);
        assertThat(failed.getErrorMessage()).isEqualTo(DocumentStateMachine.MAX_RETRIES_EXCEEDED + ": ocr crashed");
    }

    @Test
    void weakerResultCannotReplaceLocalFull() throws Exception {
        Long id = upload("plan.docx", TestDocuments.docx("Evacuation plan"));
        claim(id);
        transactionTemplate.execute(status -> stateMachine.complete(reload(id), "full text", Map.of(),
                ProcessingMode.LOCAL_FULL, InstanceTier.LOCAL));
        KbDocument doc = reload(id);
        doc.setProcessingStatus(ProcessingStatus.PROCESSING);
        kbDocumentRepository.save(doc);

        assertThatThrownBy(() -> stateMachine.complete(reload(id), "basic text", Map.of(),
                ProcessingMode.CLOUD_BASIC, InstanceTier.CLOUD))
                .isInstanceOf(IllegalStateTransitionException.class);
        assertThat(reload(id).getContent()).isEqualTo("full text");
    }

    @Test
    void completedDocumentCannotBeFailed() throws Exception {
        Long id = upload("a.txt", "done");

        assertThatThrownBy(() -> stateMachine.fail(reload(id), "late failure"))
                .isInstanceOf(IllegalStateTransitionException.class);
        assertThat(reload(id).getProcessingStatus()).isEqualTo(ProcessingStatus.COMPLETED);
    }

    @Test
    void failureReasonIsTruncated() throws Exception {
        Long id = upload("plan.docx", TestDocuments.docx("Evacuation plan"));

        stateMachine.fail(reload(id), "x".repeat(5000));

        assertThat(reload(id).getErrorMessage()).hasSize(1000);
    }

    @Test
    void requeueResetsAttemptsAndIssuesNewToken() throws Exception {
        Long id = upload("plan.docx", TestDocuments.docx("Evacuation plan"));
        String oldToken = reload(id).getClaimToken();
        KbDocument doc = reload(id);
        doc.setAttemptCount(3);
        kbDocumentRepository.save(doc);
        stateMachine.fail(reload(id), DocumentStateMachine.MAX_RETRIES_EXCEEDED);

        stateMachine.requeue(reload(id));

        KbDocument requeued = reload(id);
        assertThat(requeued.getProcessingStatus()).isEqualTo(ProcessingStatus.NEEDS_LOCAL);
        assertThat(requeued.getAttemptCount()).isZero();
        assertThat(requeued.getErrorMessage()).isNull();
        assertThat(requeued.getClaimToken()).isNotEqualTo(oldToken);
    }

    @Test
    void claimRequiresMatchingQueueToken() throws Exception {
        Long id = upload("plan.docx", TestDocuments.docx("Evacuation plan"));

        Optional<KbDocument> blank = transactionTemplate.execute(status -> stateMachine.claim(reload(id), " "));
        Optional<KbDocument> wrong = transactionTemplate.execute(status -> stateMachine.claim(reload(id), "wrong"));

        assertThat(blank).isEmpty();
        assertThat(wrong).isEmpty();
        assertThat(reload(id).getProcessingStatus()).isEqualTo(ProcessingStatus.NEEDS_LOCAL);
    }

    private KbDocument claim(Long id) {
        String token = reload(id).getClaimToken();
        Optional<KbDocument> claimed = transactionTemplate.execute(status -> stateMachine.claim(reload(id), token));
        assertThat(claimed).isPresent();
        return claimed.get();
    }
}
