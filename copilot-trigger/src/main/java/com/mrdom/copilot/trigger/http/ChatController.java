package com.mrdom.copilot.trigger.http;

import com.mrdom.copilot.api.dto.ChatMessageRequestDTO;
import com.mrdom.copilot.api.dto.ChatMessageResponseDTO;
import com.mrdom.copilot.api.response.Response;
import com.mrdom.copilot.domain.agent.service.ResponseSynthesizer;
import com.mrdom.copilot.trigger.application.command.ConversationOrchestrator;
import com.mrdom.copilot.trigger.application.common.ConversationViewAssembler;
import com.mrdom.copilot.types.enums.AgentTypeEnum;
import com.mrdom.copilot.types.enums.ResponseCode;
import com.mrdom.copilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Chat API：接收渠道转发的用户消息并返回助手回复。
 * <p>
 * 模型调用失败或请求超时时仍返回通用致歉文本，响应码与 HTTP 状态标明错误类型。
 * </p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/chat")
public class ChatController {

    private static final String STATUS_ERROR = "error";

    private final ConversationOrchestrator conversationOrchestrator;

    public ChatController(ConversationOrchestrator conversationOrchestrator) {
        this.conversationOrchestrator = conversationOrchestrator;
    }

    @PostMapping("/messages")
    public ResponseEntity<Response<ChatMessageResponseDTO>> submitMessage(@RequestBody ChatMessageRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "请求体不能为空");
        }
        ConversationOrchestrator.ConversationTurnCommand command = new ConversationOrchestrator.ConversationTurnCommand(
                request.getUserId(),
                request.getMessage(),
                request.getEnableMemory(),
                request.getContext());
        try {
            ConversationOrchestrator.ConversationTurnResult result = conversationOrchestrator.process(command);
            return ResponseEntity.ok(Response.<ChatMessageResponseDTO>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(ConversationViewAssembler.toChatResponse(result))
                    .build());
        } catch (AppException ex) {
            if (!ex.hasCode(ResponseCode.PROVIDER_ERROR) && !ex.hasCode(ResponseCode.REQUEST_TIMEOUT)) {
                throw ex;
            }
            log.warn("CHAT_FAILED userId={}, code={}, reason={}", request.getUserId(), ex.getCode(), ex.getInfo());
            HttpStatus status = ex.hasCode(ResponseCode.REQUEST_TIMEOUT)
                    ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.SERVICE_UNAVAILABLE;
            return ResponseEntity.status(status).body(Response.<ChatMessageResponseDTO>builder()
                    .code(ex.getCode())
                    .info(ex.getInfo())
                    .data(apology(request))
                    .build());
        }
    }

    private ChatMessageResponseDTO apology(ChatMessageRequestDTO request) {
        ChatMessageResponseDTO data = new ChatMessageResponseDTO();
        data.setStatus(STATUS_ERROR);
        data.setUserId(request.getUserId());
        data.setInputMessage(request.getMessage());
        data.setAgentResponse(ResponseSynthesizer.PROVIDER_FAILURE_REPLY);
        data.setAgentUsed(AgentTypeEnum.GREETING_AGENT.getCode());
        data.setMemoryEnabled(!Boolean.FALSE.equals(request.getEnableMemory()));
        data.setDegraded(true);
        return data;
    }
}
