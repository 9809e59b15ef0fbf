package com.mrdom.copilot.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 聊天消息请求，由消息渠道（经工作流转发）提交。
 */
@Data
public class ChatMessageRequestDTO {

    private String message;
    private String userId;

    /**
     * 是否读写会话记忆，缺省开启。
     */
    private Boolean enableMemory;

    /**
     * 渠道上下文，例如 channel=whatsapp；只保留标量值。
     */
    private Map<String, Object> context;
}
