package com.mrdom.copilot.domain.memory.service;

import com.mrdom.copilot.domain.memory.model.entity.ConversationHistory;
import com.mrdom.copilot.domain.memory.model.valobj.CommitReceipt;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationEntry;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationExport;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationSummary;
import com.mrdom.copilot.domain.memory.model.valobj.MemoryPolicy;
import com.mrdom.copilot.domain.memory.model.valobj.MemoryStatus;
import com.mrdom.copilot.types.common.Constants;
import com.mrdom.copilot.types.enums.ResponseCode;
import com.mrdom.copilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 进程内会话存储：userId -> 有界会话历史。
 * <p>
 * 同一用户的操作由历史自身的锁串行化，不同用户互不阻塞。清理会把历史从表中移除并置为 detached，
 * 与清理并发的追加会重新获取（或新建）历史。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-12
 */
@Slf4j
@Service
public class ConversationStore {

    private final ConcurrentMap<String, ConversationHistory> histories = new ConcurrentHashMap<>();
    private final MemoryPolicy policy;

    public ConversationStore(MemoryPolicy policy) {
        this.policy = policy == null ? MemoryPolicy.defaults() : policy;
    }

    public CommitReceipt append(String userId, ConversationEntry entry) {
        if (entry == null) {
            throw new IllegalStateException("Conversation entry cannot be null");
        }
        return appendAll(userId, List.of(entry));
    }

    /**
     * 在同一临界区内按顺序追加一批消息，用于提交一轮完整的用户/助手交换。
     */
    public CommitReceipt appendAll(String userId, List<ConversationEntry> entries) {
        String key = requireUserId(userId);
        if (entries == null || entries.isEmpty()) {
            throw new IllegalStateException("Conversation entries cannot be empty");
        }
        List<ConversationEntry> batch = List.copyOf(entries);
        while (true) {
            ConversationHistory history = histories.computeIfAbsent(key,
                    id -> ConversationHistory.create(id, policy.windowSize()));
            CommitReceipt receipt = history.appendAll(batch);
            if (receipt == null) {
                // 与 clear 竞争，历史已被摘除
                continue;
            }
            if (policy.loggingEnabled()) {
                log.info("MEMORY_APPENDED userId={}, conversationId={}, added={}, size={}, evicted={}",
                        key, receipt.conversationId(), batch.size(), receipt.size(), receipt.evicted());
            }
            return receipt;
        }
    }

    /**
     * 最近 min(count, length) 条消息；用户不存在时返回空列表。
     */
    public List<ConversationEntry> snapshot(String userId, int count) {
        String key = requireUserId(userId);
        ConversationHistory history = histories.get(key);
        if (history == null) {
            return List.of();
        }
        return history.tail(count);
    }

    /**
     * 清理用户历史；用户不存在时不做任何事。
     *
     * @return 是否存在并清理了历史
     */
    public boolean clear(String userId) {
        String key = requireUserId(userId);
        int[] removed = {-1};
        histories.computeIfPresent(key, (id, history) -> {
            removed[0] = history.detach();
            return null;
        });
        if (removed[0] < 0) {
            return false;
        }
        if (policy.loggingEnabled()) {
            log.info("MEMORY_CLEARED userId={}, removed={}", key, removed[0]);
        }
        return true;
    }

    public ConversationExport export(String userId, boolean allowEmpty) {
        String key = requireUserId(userId);
        ConversationHistory history = histories.get(key);
        List<ConversationEntry> entries = history == null ? List.of() : history.entries();
        if (entries.isEmpty()) {
            if (allowEmpty) {
                return ConversationExport.empty(key, policy.windowSize());
            }
            throw AppException.of(ResponseCode.NOT_FOUND, "用户没有会话记录: " + key);
        }
        return ConversationExport.builder()
                .userId(key)
                .conversationId(history.getConversationId())
                .windowSize(policy.windowSize())
                .exportedAt(Instant.now())
                .entries(entries)
                .build();
    }

    public ConversationSummary summarize(String userId) {
        String key = requireUserId(userId);
        ConversationHistory history = histories.get(key);
        if (history == null) {
            throw AppException.of(ResponseCode.NOT_FOUND, "用户没有会话记录: " + key);
        }
        ConversationSummary summary = history.summarize();
        if (summary.totalMessages() == 0) {
            throw AppException.of(ResponseCode.NOT_FOUND, "用户没有会话记录: " + key);
        }
        return summary;
    }

    public Optional<String> conversationIdOf(String userId) {
        ConversationHistory history = histories.get(requireUserId(userId));
        return history == null ? Optional.empty() : Optional.of(history.getConversationId());
    }

    public MemoryStatus status() {
        long total = 0L;
        for (ConversationHistory history : histories.values()) {
            total += history.size();
        }
        return new MemoryStatus(policy.enabled(), policy.windowSize(), histories.size(), total, policy.loggingEnabled());
    }

    public MemoryPolicy getPolicy() {
        return policy;
    }

    /**
     * 校验并规整用户标识。
     */
    public String requireUserId(String userId) {
        String normalized = StringUtils.trimToNull(userId);
        if (normalized == null) {
            throw AppException.of(ResponseCode.INVALID_IDENTIFIER, "userId 不能为空");
        }
        if (normalized.length() > Constants.USER_ID_MAX_LENGTH) {
            throw AppException.of(ResponseCode.INVALID_IDENTIFIER,
                    "userId 长度不能超过 " + Constants.USER_ID_MAX_LENGTH);
        }
        return normalized;
    }
}
