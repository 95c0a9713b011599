package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PullResponse {
    private List<ChangeRecord> records;
    private String nextCursor;
    private boolean hasMore;
    private Instant syncTimestamp;
}
