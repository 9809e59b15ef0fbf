package com.mrdom.copilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 意图分类。
 */
public enum IntentCategoryEnum {

    /**
     * 问候、闲聊。
     */
    GREETING("greeting"),

    /**
     * 涉及联系人、评分、营销活动等业务记录的查询。
     */
    DOMAIN_QUERY("domain_query"),

    /**
     * 无法以足够置信度分类，按问候处理。
     */
    UNKNOWN("unknown");

    private final String code;

    IntentCategoryEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean requiresExternalLookup() {
        return this == DOMAIN_QUERY;
    }
}
