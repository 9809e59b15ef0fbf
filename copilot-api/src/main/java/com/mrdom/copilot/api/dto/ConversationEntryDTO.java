package com.mrdom.copilot.api.dto;

import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * 会话消息 DTO。
 */
@Data
public class ConversationEntryDTO {

    private String role;
    private String content;
    private Instant timestamp;
    private Map<String, Object> metadata;
}
