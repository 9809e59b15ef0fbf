package com.mrdom.copilot.types.enums;

/**
 * 问候与业务查询信号同时命中时的裁决策略。
 */
public enum RoutingTieBreakEnum {

    /**
     * 业务查询优先，例如 "Olá, qual o score do joao@exemplo.com?"。
     */
    DOMAIN_QUERY_FIRST,

    /**
     * 问候优先。
     */
    GREETING_FIRST;

    public static RoutingTieBreakEnum fromText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return DOMAIN_QUERY_FIRST;
        }
        String normalized = text.trim().replace('-', '_');
        for (RoutingTieBreakEnum value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown routing tie-break: " + text);
    }
}
