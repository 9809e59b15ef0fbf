package com.mrdom.copilot.domain.memory.model.valobj;

/**
 * 记忆系统状态。
 */
public record MemoryStatus(boolean memoryEnabled,
                           int windowSize,
                           int activeConversations,
                           long totalMessages,
                           boolean loggingEnabled) {
}
