package com.mrdom.copilot.trigger.application.common;

import com.mrdom.copilot.api.dto.ChatMessageResponseDTO;
import com.mrdom.copilot.api.dto.ConversationEntryDTO;
import com.mrdom.copilot.api.dto.ConversationExportDTO;
import com.mrdom.copilot.api.dto.ConversationSummaryDTO;
import com.mrdom.copilot.api.dto.MemoryStatusDTO;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationEntry;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationExport;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationSummary;
import com.mrdom.copilot.domain.memory.model.valobj.MemoryStatus;
import com.mrdom.copilot.trigger.application.command.ConversationOrchestrator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 会话视图组装器：领域对象 -> API DTO。
 */
public final class ConversationViewAssembler {

    private ConversationViewAssembler() {
    }

    public static ChatMessageResponseDTO toChatResponse(ConversationOrchestrator.ConversationTurnResult result) {
        ChatMessageResponseDTO dto = new ChatMessageResponseDTO();
        dto.setStatus(result.getStatus());
        dto.setUserId(result.getUserId());
        dto.setInputMessage(result.getInputMessage());
        dto.setAgentResponse(result.getAgentResponse());
        dto.setAgentUsed(result.getAgentUsed());
        dto.setMemoryEnabled(result.getMemoryEnabled());
        dto.setConversationId(result.getConversationId());
        dto.setRoutingCategory(result.getRoutingCategory());
        dto.setConfidence(result.getConfidence());
        dto.setDegraded(result.getDegraded());
        dto.setQueryOutcome(result.getQueryOutcome());
        return dto;
    }

    public static ConversationEntryDTO toEntry(ConversationEntry entry) {
        if (entry == null) {
            return null;
        }
        ConversationEntryDTO dto = new ConversationEntryDTO();
        dto.setRole(entry.role().getCode());
        dto.setContent(entry.content());
        dto.setTimestamp(entry.timestamp());
        dto.setMetadata(new LinkedHashMap<>(entry.metadata()));
        return dto;
    }

    public static List<ConversationEntryDTO> toEntries(List<ConversationEntry> entries) {
        return entries.stream().map(ConversationViewAssembler::toEntry).collect(Collectors.toList());
    }

    public static ConversationExportDTO toExport(ConversationExport export) {
        ConversationExportDTO dto = new ConversationExportDTO();
        dto.setUserId(export.getUserId());
        dto.setConversationId(export.getConversationId());
        dto.setWindowSize(export.getWindowSize());
        dto.setExportedAt(export.getExportedAt());
        dto.setEntries(toEntries(export.getEntries()));
        return dto;
    }

    public static ConversationSummaryDTO toSummary(ConversationSummary summary) {
        ConversationSummaryDTO dto = new ConversationSummaryDTO();
        dto.setUserId(summary.userId());
        dto.setConversationId(summary.conversationId());
        dto.setTotalMessages(summary.totalMessages());
        dto.setUserMessages(summary.userMessages());
        dto.setAssistantMessages(summary.assistantMessages());
        dto.setConversationStart(summary.conversationStart());
        dto.setConversationEnd(summary.conversationEnd());
        dto.setLastMessage(toEntry(summary.lastMessage()));
        return dto;
    }

    public static MemoryStatusDTO toStatus(MemoryStatus status) {
        MemoryStatusDTO dto = new MemoryStatusDTO();
        dto.setMemoryEnabled(status.memoryEnabled());
        dto.setWindowSize(status.windowSize());
        dto.setActiveConversations(status.activeConversations());
        dto.setTotalMessages(status.totalMessages());
        dto.setLoggingEnabled(status.loggingEnabled());
        return dto;
    }
}
