package com.mrdom.copilot.domain.query.model.valobj;

import com.mrdom.copilot.types.enums.ExternalSourceEnum;

import java.time.Instant;

/**
 * 规整后的外部事实。
 *
 * @param source       来源系统
 * @param key          事实键
 * @param value        事实值
 * @param retrievedAt  获取时间
 * @param error        是否为失败事实
 * @param errorMessage 失败原因
 */
public record ExternalFact(ExternalSourceEnum source,
                           String key,
                           String value,
                           Instant retrievedAt,
                           boolean error,
                           String errorMessage) {

    public static final String LOOKUP_KEY = "lookup";
    public static final String NOT_FOUND_VALUE = "NOT_FOUND";
    public static final String ERROR_VALUE = "ERROR";

    public ExternalFact {
        if (source == null) {
            throw new IllegalStateException("Fact source cannot be null");
        }
        retrievedAt = retrievedAt == null ? Instant.now() : retrievedAt;
    }

    public static ExternalFact of(ExternalSourceEnum source, String key, String value) {
        return new ExternalFact(source, key, value, Instant.now(), false, null);
    }

    public static ExternalFact notFound(ExternalSourceEnum source) {
        return new ExternalFact(source, LOOKUP_KEY, NOT_FOUND_VALUE, Instant.now(), false, null);
    }

    public static ExternalFact failure(ExternalSourceEnum source, String errorMessage) {
        return new ExternalFact(source, LOOKUP_KEY, ERROR_VALUE, Instant.now(), true, errorMessage);
    }

    /**
     * 上下文中的文本形式，也用于字符预算计算。
     */
    public String render() {
        StringBuilder text = new StringBuilder()
                .append('[').append(source.getCode()).append("] ")
                .append(key).append(": ").append(value == null ? "" : value);
        if (error && errorMessage != null) {
            text.append(" (").append(errorMessage).append(')');
        }
        return text.toString();
    }
}
