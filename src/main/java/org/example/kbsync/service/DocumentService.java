package org.example.kbsync.service;

import org.example.kbsync.entity.dto.DocumentStatusResponse;
import org.example.kbsync.entity.dto.ProcessingStats;
import org.example.kbsync.entity.dto.UploadMetadata;
import org.example.kbsync.entity.dto.UploadResponse;
import org.springframework.web.multipart.MultipartFile;

/**
 * 文档上传与处理状态
 */
public interface DocumentService {
    /**
     * 保存原文件并按本实例能力同步抽取，无法定稿的文档进入本地处理队列
     * @param file 上传的文件
     * @param metadata 描述信息
     * @return 文档 id 与处理状态
     */
    UploadResponse upload(MultipartFile file, UploadMetadata metadata);

    DocumentStatusResponse getStatus(Long documentId);

    /**
     * 按状态与模式汇总
     */
    ProcessingStats getStats();

    /**
     * 重新处理失败的文档
     */
    DocumentStatusResponse reprocess(Long documentId);
}
