package com.mrdom.copilot.api.dto;

import lombok.Data;

import java.time.Instant;

/**
 * 会话摘要。
 */
@Data
public class ConversationSummaryDTO {

    private String userId;
    private String conversationId;
    private Integer totalMessages;
    private Integer userMessages;
    private Integer assistantMessages;
    private Instant conversationStart;
    private Instant conversationEnd;
    private ConversationEntryDTO lastMessage;
}
