package com.mrdom.copilot.types.enums;

/**
 * 上下文超出字符预算时的裁剪策略。
 */
public enum ContextTruncationPolicyEnum {

    /**
     * 逐条丢弃最旧的消息。
     */
    OLDEST_FIRST,

    /**
     * 丢弃最旧的一问一答（用户消息及紧随其后的助手回复）。
     */
    OLDEST_EXCHANGE_FIRST;

    public static ContextTruncationPolicyEnum fromText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return OLDEST_FIRST;
        }
        String normalized = text.trim().replace('-', '_');
        for (ContextTruncationPolicyEnum value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown truncation policy: " + text);
    }
}
