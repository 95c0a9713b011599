package org.example.kbsync.service.Impl;

import lombok.extern.slf4j.Slf4j;
import org.example.kbsync.common.BusinessException;
import org.example.kbsync.common.ResultCode;
import org.example.kbsync.service.StorageService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 默认存储：保存在本机目录下
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "kb.storage.type", havingValue = "local", matchIfMissing = true)
public class LocalFileStorageService implements StorageService {

    private final Path root;

    public LocalFileStorageService(@Value("${kb.storage.local-dir:uploads}") String localDir) {
        this.root = Path.of(localDir).toAbsolutePath().normalize();
    }

    @Override
    public String upload(String objectName, InputStream inputStream) {
        Path target = resolve(objectName);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(inputStream, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("文件保存成功，objectName: {}", objectName);
            return objectName;
        } catch (IOException e) {
            log.error("文件保存失败:", e);
            throw new BusinessException(ResultCode.FAILED, "文件保存失败: " + e.getMessage());
        }
    }

    @Override
    public InputStream getFileStream(String objectName) {
        Path target = resolve(objectName);
        try {
            return Files.newInputStream(target);
        } catch (IOException e) {
            log.error("获取文件流失败: {}", objectName, e);
            throw new BusinessException(ResultCode.NOT_FOUND, "原始文件不存在: " + objectName);
        }
    }

    @Override
    public void delete(String objectName) {
        try {
            Files.deleteIfExists(resolve(objectName));
            log.info("文件删除成功，objectName: {}", objectName);
        } catch (IOException e) {
            log.error("删除文件失败:", e);
            throw new BusinessException(ResultCode.FAILED, "删除文件失败: " + e.getMessage());
        }
    }

    // 不允许 key 跳出存储根目录
    private Path resolve(String objectName) {
        Path target = root.resolve(objectName).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("非法的存储路径: " + objectName);
        }
        return target;
    }
}
