package com.mrdom.copilot.domain.query.model.valobj;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 连接器查询结果：找到记录、记录不存在或连接器错误。
 */
public record ConnectorLookupResult(Status status, Map<String, String> record, String errorMessage) {

    public enum Status {
        FOUND,
        NOT_FOUND,
        ERROR
    }

    public ConnectorLookupResult {
        record = record == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(record));
    }

    public static ConnectorLookupResult found(Map<String, String> record) {
        return new ConnectorLookupResult(Status.FOUND, record, null);
    }

    public static ConnectorLookupResult notFound() {
        return new ConnectorLookupResult(Status.NOT_FOUND, null, null);
    }

    public static ConnectorLookupResult error(String errorMessage) {
        return new ConnectorLookupResult(Status.ERROR, null, errorMessage);
    }

    public boolean isError() {
        return status == Status.ERROR;
    }
}
