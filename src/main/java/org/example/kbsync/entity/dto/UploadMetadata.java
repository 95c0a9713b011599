package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 上传时随文件提交的描述信息，均为可选
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadMetadata {
    private String title;
    private String description;
    private String tags;
    private String location;
    private String hazardType;
    private String source;
}
