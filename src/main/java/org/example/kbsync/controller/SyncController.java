package org.example.kbsync.controller;

import lombok.RequiredArgsConstructor;
import org.example.kbsync.common.Result;
import org.example.kbsync.entity.dto.*;
import org.example.kbsync.service.SyncService;
import org.example.kbsync.worker.RestSyncClient;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * cloud 与 local 实例之间的同步接口，需要 X-Sync-API-Key
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncService syncService;

    @GetMapping("/documents/unprocessed")
    public Result<UnprocessedPage> listUnprocessed(@RequestParam(value = "cursor", required = false) String cursor,
                                                   @RequestParam(value = "limit", required = false) Integer limit) {
        return Result.success(syncService.listUnprocessed(cursor, limit));
    }

    @PostMapping("/documents/{id}/claim")
    public Result<ClaimResponse> claim(@PathVariable("id") Long documentId, @RequestBody ClaimRequest request) {
        return Result.success(syncService.claim(documentId, request));
    }

    @GetMapping("/documents/{id}/download")
    public ResponseEntity<InputStreamResource> download(@PathVariable("id") Long documentId,
                                                        @RequestHeader(RestSyncClient.CLAIM_TOKEN_HEADER) String leaseToken) {
        StoredFile file = syncService.download(documentId, leaseToken);
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(file.getFilename(), StandardCharsets.UTF_8)
                        .build()
                        .toString());
        if (file.getSize() != null) {
            builder.contentLength(file.getSize());
        }
        return builder.body(new InputStreamResource(file.getStream()));
    }

    @PostMapping("/documents/{id}/processed")
    public Result<SubmitResponse> submitProcessed(@PathVariable("id") Long documentId,
                                                  @RequestBody ProcessedContentRequest request) {
        return Result.success(syncService.submit(documentId, request));
    }

    @PostMapping("/documents/{id}/release")
    public Result<DocumentStatusResponse> release(@PathVariable("id") Long documentId,
                                                  @RequestBody ReleaseRequest request) {
        return Result.success(syncService.release(documentId, request));
    }

    @GetMapping("/pull")
    public Result<PullResponse> pull(@RequestParam(value = "since", required = false) Instant since,
                                     @RequestParam(value = "cursor", required = false) String cursor,
                                     @RequestParam(value = "limit", required = false) Integer limit) {
        return Result.success(syncService.pull(since, cursor, limit));
    }

    @PostMapping("/push")
    public Result<PushResponse> push(@RequestBody PushRequest request) {
        return Result.success(syncService.push(request));
    }

    @GetMapping("/status")
    public Result<SyncStatusResponse> status() {
        return Result.success(syncService.status());
    }
}
