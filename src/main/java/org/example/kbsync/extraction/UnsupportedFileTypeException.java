package org.example.kbsync.extraction;

/**
 * 未知或不支持的文件类型，属于校验错误，不会自动重试
 */
public class UnsupportedFileTypeException extends ExtractionException {

    public UnsupportedFileTypeException(String extension) {
        super("不支持的文件类型: " + (extension == null || extension.isEmpty() ? "(无扩展名)" : extension));
    }
}
