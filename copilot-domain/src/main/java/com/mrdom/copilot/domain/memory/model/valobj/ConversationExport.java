package com.mrdom.copilot.domain.memory.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 会话导出值对象。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationExport {

    private String userId;

    /**
     * 会话 ID，导出空记录时为 null
     */
    private String conversationId;

    private int windowSize;

    private Instant exportedAt;

    /**
     * 按时间顺序排列的窗口内消息
     */
    private List<ConversationEntry> entries;

    public static ConversationExport empty(String userId, int windowSize) {
        return ConversationExport.builder()
                .userId(userId)
                .windowSize(windowSize)
                .exportedAt(Instant.now())
                .entries(List.of())
                .build();
    }
}
