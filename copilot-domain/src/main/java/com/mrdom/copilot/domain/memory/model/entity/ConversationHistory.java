package com.mrdom.copilot.domain.memory.model.entity;

import com.google.common.collect.EvictingQueue;
import com.mrdom.copilot.domain.memory.model.valobj.CommitReceipt;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationEntry;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationSummary;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 会话历史聚合根。
 * <p>
 * 一个用户标识独占一份历史，消息按写入顺序保存，长度不超过窗口大小，超出时淘汰最旧的消息。
 * 所有读写都在自身的锁内完成；被清理后历史进入 detached 状态，不再接受写入。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-12
 */
public class ConversationHistory {

    @Getter
    private final String userId;
    @Getter
    private final String conversationId;
    @Getter
    private final Instant createdAt;
    @Getter
    private final int windowSize;

    private final EvictingQueue<ConversationEntry> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean detached;

    private ConversationHistory(String userId, int windowSize) {
        this.userId = userId;
        this.windowSize = windowSize;
        this.conversationId = UUID.randomUUID().toString();
        this.createdAt = Instant.now();
        this.entries = EvictingQueue.create(windowSize);
    }

    public static ConversationHistory create(String userId, int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalStateException("History window size must be positive");
        }
        return new ConversationHistory(userId, windowSize);
    }

    /**
     * 按顺序追加一批消息。
     *
     * @return 追加结果；历史已被清理时返回 null，调用方需要重新获取历史
     */
    public CommitReceipt appendAll(List<ConversationEntry> batch) {
        lock.lock();
        try {
            if (detached) {
                return null;
            }
            int evicted = 0;
            for (ConversationEntry entry : batch) {
                if (entries.remainingCapacity() == 0) {
                    evicted++;
                }
                entries.add(entry);
            }
            return new CommitReceipt(conversationId, entries.size(), evicted);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 最近 count 条消息，按时间顺序。
     */
    public List<ConversationEntry> tail(int count) {
        lock.lock();
        try {
            if (count <= 0 || entries.isEmpty()) {
                return List.of();
            }
            List<ConversationEntry> all = new ArrayList<>(entries);
            int from = Math.max(0, all.size() - count);
            return List.copyOf(all.subList(from, all.size()));
        } finally {
            lock.unlock();
        }
    }

    public List<ConversationEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清空并标记为 detached。
     *
     * @return 清理前的消息数
     */
    public int detach() {
        lock.lock();
        try {
            int removed = entries.size();
            entries.clear();
            detached = true;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public ConversationSummary summarize() {
        lock.lock();
        try {
            int userCount = 0;
            int assistantCount = 0;
            ConversationEntry first = null;
            ConversationEntry last = null;
            for (ConversationEntry entry : entries) {
                if (first == null) {
                    first = entry;
                }
                last = entry;
                if (entry.isUser()) {
                    userCount++;
                } else if (entry.isAssistant()) {
                    assistantCount++;
                }
            }
            return new ConversationSummary(userId,
                    conversationId,
                    entries.size(),
                    userCount,
                    assistantCount,
                    first == null ? null : first.timestamp(),
                    last == null ? null : last.timestamp(),
                    last);
        } finally {
            lock.unlock();
        }
    }
}
