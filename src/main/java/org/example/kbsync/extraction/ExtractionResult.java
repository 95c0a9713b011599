package org.example.kbsync.extraction;

import lombok.Value;

import java.util.Map;

@Value
public class ExtractionResult {
    String content;
    Map<String, Object> metadata;
}
