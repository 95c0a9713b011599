package org.example.kbsync.entity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UnprocessedPage {
    private List<UnprocessedDocument> items;
    // 最后一条的 id，下一页从它之后继续
    private String nextCursor;
    private boolean hasMore;
}
