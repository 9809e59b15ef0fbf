package com.mrdom.copilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 负责作答的处理 Agent。
 */
public enum AgentTypeEnum {

    GREETING_AGENT("greeting_agent"),

    CRM_MARKETING_AGENT("crm_marketing_agent");

    private final String code;

    AgentTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static AgentTypeEnum forCategory(IntentCategoryEnum category) {
        return category != null && category.requiresExternalLookup() ? CRM_MARKETING_AGENT : GREETING_AGENT;
    }
}
