package com.mrdom.copilot.trigger.http;

import com.mrdom.copilot.api.dto.ConversationEntryDTO;
import com.mrdom.copilot.api.dto.ConversationExportDTO;
import com.mrdom.copilot.api.dto.ConversationSummaryDTO;
import com.mrdom.copilot.api.dto.MemoryStatusDTO;
import com.mrdom.copilot.api.response.Response;
import com.mrdom.copilot.trigger.application.command.ConversationOrchestrator;
import com.mrdom.copilot.trigger.application.common.ConversationViewAssembler;
import com.mrdom.copilot.types.enums.ResponseCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 记忆管理 API：状态、摘要、快照、清理与导出。
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/memory")
public class MemoryAdminController {

    private final ConversationOrchestrator conversationOrchestrator;

    public MemoryAdminController(ConversationOrchestrator conversationOrchestrator) {
        this.conversationOrchestrator = conversationOrchestrator;
    }

    @GetMapping("/status")
    public Response<MemoryStatusDTO> status() {
        return success(ConversationViewAssembler.toStatus(conversationOrchestrator.status()));
    }

    @GetMapping("/conversations/{userId}/summary")
    public Response<ConversationSummaryDTO> summary(@PathVariable("userId") String userId) {
        return success(ConversationViewAssembler.toSummary(conversationOrchestrator.summarize(userId)));
    }

    @GetMapping("/conversations/{userId}/messages")
    public Response<List<ConversationEntryDTO>> messages(@PathVariable("userId") String userId,
                                                         @RequestParam(value = "count", defaultValue = "10") Integer count) {
        return success(ConversationViewAssembler.toEntries(conversationOrchestrator.snapshot(userId, count)));
    }

    @DeleteMapping("/conversations/{userId}")
    public Response<Boolean> clear(@PathVariable("userId") String userId) {
        boolean removed = conversationOrchestrator.clear(userId);
        log.info("MEMORY_ADMIN_CLEAR userId={}, removed={}", userId, removed);
        return success(removed);
    }

    @GetMapping("/conversations/{userId}/export")
    public Response<ConversationExportDTO> export(@PathVariable("userId") String userId,
                                                  @RequestParam(value = "allowEmpty", defaultValue = "false") Boolean allowEmpty) {
        return success(ConversationViewAssembler.toExport(
                conversationOrchestrator.export(userId, Boolean.TRUE.equals(allowEmpty))));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
