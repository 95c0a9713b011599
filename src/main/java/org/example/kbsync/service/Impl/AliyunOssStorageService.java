package org.example.kbsync.service.Impl;

import com.aliyun.oss.OSS;
import com.aliyun.oss.OSSClientBuilder;
import com.aliyun.oss.OSSException;
import com.aliyun.oss.ClientException;
import com.aliyun.oss.model.OSSObject;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.common.BusinessException;
import org.example.kbsync.common.ResultCode;
import org.example.kbsync.service.StorageService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.InputStream;

/**
 * kb.storage.type=oss 时使用阿里云 OSS 保存原始文件
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "kb.storage.type", havingValue = "oss")
public class AliyunOssStorageService implements StorageService {
    @Value("${kb.storage.oss.endpoint}")
    private String endpoint;
    @Value("${kb.storage.oss.access-key-id}")
    private String accessKeyId;
    @Value("${kb.storage.oss.access-key-secret}")
    private String accessKeySecret;
    @Value("${kb.storage.oss.bucket-name}")
    private String bucketName;

    private OSS ossClient;

    @PostConstruct
    public void init() {
        ossClient = new OSSClientBuilder().build(endpoint, accessKeyId, accessKeySecret);
        log.info("OSS 存储已初始化，bucket: {}", bucketName);
    }

    @PreDestroy
    public void shutdown() {
        if (ossClient != null) {
            ossClient.shutdown();
        }
    }

    @Override
    public String upload(String objectName, InputStream inputStream) {
        try {
            ossClient.putObject(bucketName, objectName, inputStream);
            log.info("文件上传成功，objectName: {}", objectName);
            return objectName;
        } catch (OSSException | ClientException e) {
            log.error("文件上传失败:", e);
            throw new BusinessException(ResultCode.FAILED, "文件上传失败: " + e.getMessage());
        }
    }

    @Override
    public InputStream getFileStream(String objectName) {
        try {
            OSSObject ossObject = ossClient.getObject(bucketName, objectName);
            return ossObject.getObjectContent();
        } catch (OSSException e) {
            log.error("获取文件流失败: {}", objectName, e);
            throw new BusinessException(ResultCode.NOT_FOUND, "原始文件不存在: " + objectName);
        } catch (ClientException e) {
            log.error("获取文件流失败:", e);
            throw new BusinessException(ResultCode.FAILED, "获取文件流失败: " + e.getMessage());
        }
    }

    @Override
    public void delete(String objectName) {
        try {
            ossClient.deleteObject(bucketName, objectName);
            log.info("文件删除成功，objectName: {}", objectName);
        } catch (OSSException | ClientException e) {
            log.error("删除文件失败:", e);
            throw new BusinessException(ResultCode.FAILED, "删除文件失败: " + e.getMessage());
        }
    }
}
