package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChangeRecord {
    private RecordKind kind;
    private Long id;
    private Instant updatedAt;
    private Map<String, Object> data;
}
