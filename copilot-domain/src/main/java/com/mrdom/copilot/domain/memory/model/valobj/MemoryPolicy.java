package com.mrdom.copilot.domain.memory.model.valobj;

import com.mrdom.copilot.types.enums.ContextTruncationPolicyEnum;

/**
 * 记忆策略。
 *
 * @param enabled            是否启用会话记忆
 * @param windowSize         每个用户保留的最大消息数
 * @param contextEntries     组装上下文时读取的最近消息数
 * @param contextCharBudget  上下文字符预算，小于等于 0 表示不限制
 * @param truncationPolicy   超出预算时的截断策略
 * @param loggingEnabled     是否输出记忆操作日志
 */
public record MemoryPolicy(boolean enabled,
                           int windowSize,
                           int contextEntries,
                           int contextCharBudget,
                           ContextTruncationPolicyEnum truncationPolicy,
                           boolean loggingEnabled) {

    public static final int DEFAULT_WINDOW_SIZE = 10;
    public static final int DEFAULT_CONTEXT_CHAR_BUDGET = 6000;

    public MemoryPolicy {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        contextEntries = contextEntries <= 0 ? windowSize : Math.min(contextEntries, windowSize);
        truncationPolicy = truncationPolicy == null ? ContextTruncationPolicyEnum.OLDEST_FIRST : truncationPolicy;
    }

    public static MemoryPolicy defaults() {
        return new MemoryPolicy(true, DEFAULT_WINDOW_SIZE, DEFAULT_WINDOW_SIZE, DEFAULT_CONTEXT_CHAR_BUDGET,
                ContextTruncationPolicyEnum.OLDEST_FIRST, true);
    }

    public MemoryPolicy withWindowSize(int size) {
        return new MemoryPolicy(enabled, size, size, contextCharBudget, truncationPolicy, loggingEnabled);
    }
}
