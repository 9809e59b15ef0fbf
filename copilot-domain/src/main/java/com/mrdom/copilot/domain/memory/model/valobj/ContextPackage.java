package com.mrdom.copilot.domain.memory.model.valobj;

import com.mrdom.copilot.domain.query.model.valobj.ExternalFact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次请求的上下文包，不落库。
 *
 * @param userId         用户标识
 * @param currentMessage 当前消息
 * @param history        最近的历史消息，按时间顺序
 * @param facts          外部事实
 * @param metadata       预算观测信息
 */
public record ContextPackage(String userId,
                             String currentMessage,
                             List<ConversationEntry> history,
                             List<ExternalFact> facts,
                             Map<String, Object> metadata) {

    public static final String BUDGET_CHARS = "budgetChars";
    public static final String USED_CHARS = "usedChars";
    public static final String DROPPED_ENTRIES = "droppedEntries";
    public static final String TRUNCATED = "truncated";
    public static final String OVER_BUDGET_AFTER_TRUNCATION = "overBudgetAfterTruncation";
    public static final String HISTORY_INCLUDED = "historyIncluded";

    public ContextPackage {
        currentMessage = currentMessage == null ? "" : currentMessage;
        history = history == null ? List.of() : List.copyOf(history);
        facts = facts == null ? List.of() : List.copyOf(facts);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean isTruncated() {
        return Boolean.TRUE.equals(metadata.get(TRUNCATED));
    }

    public int droppedEntries() {
        Object value = metadata.get(DROPPED_ENTRIES);
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }
}
