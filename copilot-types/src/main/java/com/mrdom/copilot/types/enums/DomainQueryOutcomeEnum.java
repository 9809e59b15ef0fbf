package com.mrdom.copilot.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 业务查询聚合结果。
 */
public enum DomainQueryOutcomeEnum {

    /** 所有相关系统均返回结果（含未找到）。 */
    COMPLETE("complete"),

    /** 部分系统失败，其余成功。 */
    PARTIAL("partial"),

    /** 所有相关系统均失败。 */
    DEGRADED_NO_DATA("degraded_no_data"),

    /** 消息中没有可用于查询的联系人标识，未发起调用。 */
    NO_IDENTIFIER("no_identifier");

    private final String code;

    DomainQueryOutcomeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isDegraded() {
        return this == DEGRADED_NO_DATA;
    }
}
