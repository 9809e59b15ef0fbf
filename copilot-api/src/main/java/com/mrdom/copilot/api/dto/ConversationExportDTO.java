package com.mrdom.copilot.api.dto;

import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * 会话导出记录。
 */
@Data
public class ConversationExportDTO {

    private String userId;
    private String conversationId;
    private Integer windowSize;
    private Instant exportedAt;
    private List<ConversationEntryDTO> entries;
}
