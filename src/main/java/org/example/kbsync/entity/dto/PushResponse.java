package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PushResponse {
    private int processedCount;
    private int failedCount;
    private List<SubmitResponse> results = new ArrayList<>();
    private List<PushError> errors = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PushError {
        private Long documentId;
        private int code;
        private String error;
    }
}
