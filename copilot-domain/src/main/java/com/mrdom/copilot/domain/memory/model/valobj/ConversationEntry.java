package com.mrdom.copilot.domain.memory.model.valobj;

import com.google.common.collect.ImmutableMap;
import com.mrdom.copilot.types.enums.MessageRoleEnum;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Map;

/**
 * 一条会话消息。创建后不可变，元数据只保留标量值（String、Number、Boolean）。
 *
 * @param role      消息角色
 * @param content   消息内容
 * @param timestamp 写入时间
 * @param metadata  元数据（渠道、Agent、路由分类、降级标记等）
 */
@Slf4j
public record ConversationEntry(MessageRoleEnum role,
                                String content,
                                Instant timestamp,
                                Map<String, Object> metadata) {

    public ConversationEntry {
        if (role == null) {
            throw new IllegalStateException("Message role cannot be null");
        }
        if (content == null) {
            throw new IllegalStateException("Message content cannot be null");
        }
        timestamp = timestamp == null ? Instant.now() : timestamp;
        metadata = scalarCopy(metadata);
    }

    public static ConversationEntry user(String content, Map<String, Object> metadata) {
        return new ConversationEntry(MessageRoleEnum.USER, content, Instant.now(), metadata);
    }

    public static ConversationEntry assistant(String content, Map<String, Object> metadata) {
        return new ConversationEntry(MessageRoleEnum.ASSISTANT, content, Instant.now(), metadata);
    }

    public boolean isUser() {
        return role == MessageRoleEnum.USER;
    }

    public boolean isAssistant() {
        return role == MessageRoleEnum.ASSISTANT;
    }

    private static Map<String, Object> scalarCopy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return ImmutableMap.of();
        }
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        for (Map.Entry<String, Object> item : source.entrySet()) {
            Object value = item.getValue();
            if (item.getKey() == null || value == null) {
                continue;
            }
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                builder.put(item.getKey(), value);
            } else {
                log.debug("MEMORY_METADATA_DROPPED key={}, type={}", item.getKey(), value.getClass().getSimpleName());
            }
        }
        return builder.build();
    }
}
