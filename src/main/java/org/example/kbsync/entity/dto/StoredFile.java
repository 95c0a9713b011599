package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.io.InputStream;

/**
 * 供 local 实例下载的原始文件
 */
@Data
@AllArgsConstructor
public class StoredFile {
    private String filename;
    private String contentType;
    private Long size;
    private InputStream stream;
}
