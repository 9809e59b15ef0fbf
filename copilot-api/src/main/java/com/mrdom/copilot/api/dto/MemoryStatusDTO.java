package com.mrdom.copilot.api.dto;

import lombok.Data;

/**
 * 会话记忆状态。
 */
@Data
public class MemoryStatusDTO {

    private Boolean memoryEnabled;
    private Integer windowSize;
    private Integer activeConversations;
    private Long totalMessages;
    private Boolean loggingEnabled;
}
