package com.mrdom.copilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 外部业务记录系统。
 */
public enum ExternalSourceEnum {

    /**
     * 客户关系系统（Vtiger）。
     */
    CRM("crm"),

    /**
     * 营销系统（Mautic）。
     */
    MARKETING("marketing");

    private final String code;

    ExternalSourceEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
