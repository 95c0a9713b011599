package org.example.kbsync.controller;

import lombok.RequiredArgsConstructor;
import org.example.kbsync.common.Result;
import org.example.kbsync.entity.dto.DocumentStatusResponse;
import org.example.kbsync.entity.dto.ProcessingStats;
import org.example.kbsync.entity.dto.UploadMetadata;
import org.example.kbsync.entity.dto.UploadResponse;
import org.example.kbsync.service.DocumentService;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    @PostMapping("/upload")
    public Result<UploadResponse> uploadDocument(@RequestParam("file") MultipartFile file,
                                                 @RequestParam(value = "title", required = false) String title,
                                                 @RequestParam(value = "description", required = false) String description,
                                                 @RequestParam(value = "tags", required = false) String tags,
                                                 @RequestParam(value = "location", required = false) String location,
                                                 @RequestParam(value = "hazardType", required = false) String hazardType,
                                                 @RequestParam(value = "source", required = false) String source) {
        UploadMetadata metadata = UploadMetadata.builder()
                .title(title)
                .description(description)
                .tags(tags)
                .location(location)
                .hazardType(hazardType)
                .source(source)
                .build();
        UploadResponse response = documentService.upload(file, metadata);
        return Result.success(response, response.getMessage());
    }

    @GetMapping("/{id}/status")
    public Result<DocumentStatusResponse> getStatus(@PathVariable("id") Long documentId) {
        return Result.success(documentService.getStatus(documentId));
    }

    @GetMapping("/processing/stats")
    public Result<ProcessingStats> getStats() {
        return Result.success(documentService.getStats());
    }

    @PostMapping("/{id}/reprocess")
    public Result<DocumentStatusResponse> reprocess(@PathVariable("id") Long documentId) {
        return Result.success(documentService.reprocess(documentId));
    }
}
