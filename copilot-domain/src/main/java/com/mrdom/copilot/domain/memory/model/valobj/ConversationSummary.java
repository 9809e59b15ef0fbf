package com.mrdom.copilot.domain.memory.model.valobj;

import java.time.Instant;

/**
 * 会话摘要：消息计数、起止时间与最后一条消息。
 */
public record ConversationSummary(String userId,
                                  String conversationId,
                                  int totalMessages,
                                  int userMessages,
                                  int assistantMessages,
                                  Instant conversationStart,
                                  Instant conversationEnd,
                                  ConversationEntry lastMessage) {
}
