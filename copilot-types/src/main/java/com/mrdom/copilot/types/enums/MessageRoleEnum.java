package com.mrdom.copilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对话消息角色枚举。
 */
public enum MessageRoleEnum {
    USER("user"),
    ASSISTANT("assistant");

    private final String code;

    MessageRoleEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
