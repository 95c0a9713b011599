package org.example.kbsync.service;

import java.io.InputStream;

/**
 * 原始文件存储。cloud 实例保存上传的原文件，local 实例通过同步协议下载。
 */
public interface StorageService {
    /**
     * 上传文件
     * @param objectName 存储 key
     * @param inputStream 文件内容
     * @return 实际使用的存储 key
     */
    String upload(String objectName, InputStream inputStream);

    /**
     * 获取文件流，调用方负责关闭
     */
    InputStream getFileStream(String objectName);

    /**
     * 删除文件
     */
    void delete(String objectName);
}
