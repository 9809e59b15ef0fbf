package com.mrdom.copilot.api.dto;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 聊天消息处理结果。
 */
@Data
public class ChatMessageResponseDTO {

    /**
     * success / error。
     */
    private String status;
    private String userId;
    private String inputMessage;
    private String agentResponse;
    private String agentUsed;
    private Boolean memoryEnabled;
    private String conversationId;
    private String routingCategory;
    private BigDecimal confidence;
    private Boolean degraded;
    private String queryOutcome;
}
