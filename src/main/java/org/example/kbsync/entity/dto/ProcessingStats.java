package org.example.kbsync.entity.dto;

import lombok.Data;
import org.example.kbsync.entity.InstanceTier;

import java.util.List;
import java.util.Map;

@Data
public class ProcessingStats {
    private Map<String, Long> byStatus;
    private Map<String, Long> byMode;
    private long needsFullProcessing;
    private long total;
    private InstanceTier tier;
    private List<String> finalFormats;
    private List<String> deferredFormats;
}
