package org.example.kbsync.extraction;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 选择抽取策略所依据的文件类型。PDF 按是否带有可用文本层拆成两类。
 */
public enum FileType {

    TEXT(Set.of("txt", "text")),
    MARKDOWN(Set.of("md", "markdown")),
    PDF_TEXT(Set.of()),
    PDF_SCANNED(Set.of()),
    DOCX(Set.of("docx", "doc", "odt", "rtf")),
    PPTX(Set.of("pptx", "ppt", "odp")),
    XLSX(Set.of("xlsx", "xls", "ods")),
    HTML(Set.of("html", "htm")),
    UNKNOWN(Set.of());

    public static final String PDF_EXTENSION = "pdf";

    private static final Map<String, FileType> BY_EXTENSION = new HashMap<>();

    static {
        for (FileType type : values()) {
            for (String extension : type.extensions) {
                BY_EXTENSION.put(extension, type);
            }
        }
    }

    private final Set<String> extensions;

    FileType(Set<String> extensions) {
        this.extensions = extensions;
    }

    /**
     * 该类型对应的扩展名，两类 PDF 都返回 pdf
     */
    public Set<String> getExtensions() {
        if (this == PDF_TEXT || this == PDF_SCANNED) {
            return Set.of(PDF_EXTENSION);
        }
        return extensions;
    }

    /**
     * 不需要读取文件内容就能确定的类型；pdf 与未知扩展名返回 UNKNOWN
     */
    public static FileType fromExtension(String extension) {
        if (extension == null) {
            return UNKNOWN;
        }
        return BY_EXTENSION.getOrDefault(extension.toLowerCase(Locale.ROOT), UNKNOWN);
    }

    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
