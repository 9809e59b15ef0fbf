package com.mrdom.copilot.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mrdom.copilot.types.enums.ResponseCode;
import com.mrdom.copilot.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * JSON 编解码工具。
 *
 * @author mrdom
 * @since 2026-10-14
 */
@Component
public class JsonCodec {

    private final ObjectMapper objectMapper;

    /**
     * 创建 JsonCodec。
     */
    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取 JSON 为树；空文本返回 MissingNode。
     */
    public JsonNode readTree(String json) {
        if (StringUtils.isBlank(json)) {
            return objectMapper.missingNode();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    /**
     * 读取节点的文本值；缺失、null 或空白时返回 null。
     */
    public String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return StringUtils.trimToNull(value.isValueNode() ? value.asText() : value.toString());
    }
}
