package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClaimResponse {
    private Long documentId;
    private String leaseToken;
    private int attemptCount;
}
