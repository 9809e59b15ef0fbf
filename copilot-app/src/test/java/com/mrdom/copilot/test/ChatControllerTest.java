package com.mrdom.copilot.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mrdom.copilot.domain.agent.service.ResponseSynthesizer;
import com.mrdom.copilot.trigger.application.command.ConversationOrchestrator;
import com.mrdom.copilot.trigger.application.command.ConversationOrchestrator.ConversationTurnCommand;
import com.mrdom.copilot.trigger.application.command.ConversationOrchestrator.ConversationTurnResult;
import com.mrdom.copilot.trigger.http.ChatController;
import com.mrdom.copilot.trigger.http.GlobalApiExceptionHandler;
import com.mrdom.copilot.types.enums.ResponseCode;
import com.mrdom.copilot.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ChatControllerTest {

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;
    private ConversationOrchestrator conversationOrchestrator;

    @BeforeEach
    public void setUp() {
        this.conversationOrchestrator = mock(ConversationOrchestrator.class);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(conversationOrchestrator))
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Test
    public void shouldReturnAgentReply() throws Exception {
        ConversationTurnResult result = new ConversationTurnResult();
        result.setStatus("success");
        result.setUserId("whatsapp:+5511999");
        result.setInputMessage("Olá");
        result.setAgentResponse("Olá! Como posso ajudar?");
        result.setAgentUsed("greeting_agent");
        result.setMemoryEnabled(true);
        result.setConversationId("c-1");
        result.setRoutingCategory("greeting");
        result.setConfidence(new BigDecimal("0.90"));
        result.setDegraded(false);
        when(conversationOrchestrator.process(any())).thenReturn(result);

        String payload = objectMapper.writeValueAsString(Map.of(
                "userId", "whatsapp:+5511999",
                "message", "Olá",
                "context", Map.of("channel", "whatsapp")));

        mockMvc.perform(post("/api/v1/chat/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ResponseCode.SUCCESS.getCode()))
                .andExpect(jsonPath("$.data.status").value("success"))
                .andExpect(jsonPath("$.data.agentResponse").value("Olá! Como posso ajudar?"))
                .andExpect(jsonPath("$.data.agentUsed").value("greeting_agent"))
                .andExpect(jsonPath("$.data.conversationId").value("c-1"))
                .andExpect(jsonPath("$.data.confidence").value(0.9));

        ArgumentCaptor<ConversationTurnCommand> captor = ArgumentCaptor.forClass(ConversationTurnCommand.class);
        verify(conversationOrchestrator).process(captor.capture());
        Assertions.assertEquals("whatsapp:+5511999", captor.getValue().userId());
        Assertions.assertNull(captor.getValue().enableMemory());
        Assertions.assertEquals("whatsapp", captor.getValue().context().get("channel"));
    }

    @Test
    public void shouldReturnApologyWhenProviderFails() throws Exception {
        when(conversationOrchestrator.process(any()))
                .thenThrow(new AppException(ResponseCode.PROVIDER_ERROR.getCode(), "模型调用失败: provider down"));

        String payload = objectMapper.writeValueAsString(Map.of("userId", "u-1", "message", "Olá"));

        mockMvc.perform(post("/api/v1/chat/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value(ResponseCode.PROVIDER_ERROR.getCode()))
                .andExpect(jsonPath("$.data.status").value("error"))
                .andExpect(jsonPath("$.data.agentResponse").value(ResponseSynthesizer.PROVIDER_FAILURE_REPLY))
                .andExpect(jsonPath("$.data.degraded").value(true));
    }

    @Test
    public void shouldReturnGatewayTimeoutWhenRequestExpires() throws Exception {
        when(conversationOrchestrator.process(any()))
                .thenThrow(new AppException(ResponseCode.REQUEST_TIMEOUT.getCode(), "请求超过 30000ms 未完成"));

        String payload = objectMapper.writeValueAsString(Map.of("userId", "u-1", "message", "Olá"));

        mockMvc.perform(post("/api/v1/chat/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.code").value(ResponseCode.REQUEST_TIMEOUT.getCode()))
                .andExpect(jsonPath("$.data.agentResponse").value(ResponseSynthesizer.PROVIDER_FAILURE_REPLY));
    }

    @Test
    public void shouldRejectInvalidIdentifier() throws Exception {
        when(conversationOrchestrator.process(any()))
                .thenThrow(AppException.of(ResponseCode.INVALID_IDENTIFIER, "userId 不能为空"));

        String payload = objectMapper.writeValueAsString(Map.of("userId", " ", "message", "Olá"));

        mockMvc.perform(post("/api/v1/chat/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ResponseCode.INVALID_IDENTIFIER.getCode()))
                .andExpect(jsonPath("$.info").value("userId 不能为空"));
    }

    @Test
    public void shouldRejectUnreadableBody() throws Exception {
        mockMvc.perform(post("/api/v1/chat/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }
}
