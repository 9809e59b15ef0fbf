package com.mrdom.copilot.domain.memory.model.valobj;

/**
 * 一次追加的结果。
 *
 * @param conversationId 会话 ID
 * @param size           追加后的历史长度
 * @param evicted        因窗口约束被淘汰的消息数
 */
public record CommitReceipt(String conversationId, int size, int evicted) {
}
