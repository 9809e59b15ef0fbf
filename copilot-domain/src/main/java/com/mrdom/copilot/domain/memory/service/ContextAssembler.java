package com.mrdom.copilot.domain.memory.service;

import com.mrdom.copilot.domain.memory.model.valobj.ContextPackage;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationEntry;
import com.mrdom.copilot.domain.memory.model.valobj.MemoryPolicy;
import com.mrdom.copilot.domain.query.model.valobj.ExternalFact;
import com.mrdom.copilot.types.enums.ContextTruncationPolicyEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 上下文组装领域服务：读取最近历史，合并外部事实，并保证不超过字符预算。
 * <p>
 * 超出预算时按截断策略从最旧的历史开始丢弃，丢弃数量写入上下文元数据；当前消息和外部事实本身
 * 超出预算时丢弃全部历史并记录 overBudgetAfterTruncation。
 * </p>
 */
@Slf4j
@Service
public class ContextAssembler {

    private final ConversationStore conversationStore;

    public ContextAssembler(ConversationStore conversationStore) {
        this.conversationStore = conversationStore;
    }

    public ContextPackage prepare(String userId, String message, List<ExternalFact> facts, boolean includeHistory) {
        MemoryPolicy policy = conversationStore.getPolicy();
        List<ExternalFact> safeFacts = facts == null ? List.of() : facts;
        List<ConversationEntry> history = includeHistory
                ? new ArrayList<>(conversationStore.snapshot(userId, policy.contextEntries()))
                : new ArrayList<>();

        int budget = policy.contextCharBudget();
        int used = length(message);
        for (ExternalFact fact : safeFacts) {
            used += fact.render().length();
        }
        for (ConversationEntry entry : history) {
            used += length(entry.content());
        }

        int dropped = 0;
        if (budget > 0) {
            while (used > budget && !history.isEmpty()) {
                int count = dropCount(history, policy.truncationPolicy());
                for (int i = 0; i < count; i++) {
                    used -= length(history.remove(0).content());
                    dropped++;
                }
            }
        }
        boolean overBudget = budget > 0 && used > budget;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ContextPackage.BUDGET_CHARS, budget);
        metadata.put(ContextPackage.USED_CHARS, used);
        metadata.put(ContextPackage.DROPPED_ENTRIES, dropped);
        metadata.put(ContextPackage.TRUNCATED, dropped > 0);
        metadata.put(ContextPackage.OVER_BUDGET_AFTER_TRUNCATION, overBudget);
        metadata.put(ContextPackage.HISTORY_INCLUDED, includeHistory);
        if (dropped > 0 || overBudget) {
            log.info("CONTEXT_TRUNCATED userId={}, dropped={}, usedChars={}, budgetChars={}, overBudget={}",
                    userId, dropped, used, budget, overBudget);
        }
        return new ContextPackage(userId, message, history, safeFacts, metadata);
    }

    private static int dropCount(List<ConversationEntry> history, ContextTruncationPolicyEnum truncationPolicy) {
        if (truncationPolicy == ContextTruncationPolicyEnum.OLDEST_EXCHANGE_FIRST
                && history.size() >= 2
                && history.get(0).isUser()
                && history.get(1).isAssistant()) {
            return 2;
        }
        return 1;
    }

    private static int length(String text) {
        return text == null ? 0 : text.length();
    }
}
