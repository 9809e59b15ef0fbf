package com.mrdom.copilot.test.infrastructure;

import com.mrdom.copilot.domain.agent.model.valobj.ModelParameters;
import com.mrdom.copilot.domain.memory.model.valobj.ContextPackage;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationEntry;
import com.mrdom.copilot.domain.query.model.valobj.ExternalFact;
import com.mrdom.copilot.infrastructure.ai.SpringAiTextCompletionGateway;
import com.mrdom.copilot.types.enums.ExternalSourceEnum;
import com.mrdom.copilot.types.enums.ResponseCode;
import com.mrdom.copilot.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SpringAiTextCompletionGatewayTest {

    private final ContextPackage context = new ContextPackage("u-1",
            "Qual o lead score de maria@exemplo.com?",
            List.of(ConversationEntry.user("Olá", null), ConversationEntry.assistant("Olá! Como posso ajudar?", null)),
            List.of(ExternalFact.of(ExternalSourceEnum.CRM, "lead_score", "87"),
                    ExternalFact.failure(ExternalSourceEnum.MARKETING, "timeout after 3000ms")),
            Map.of());

    @Test
    public void shouldBuildPromptFromContext() {
        SpringAiTextCompletionGateway gateway = new SpringAiTextCompletionGateway(provider(null));

        Prompt prompt = gateway.buildPrompt(context, "Você é o agente de CRM.", new ModelParameters("gpt-4o-mini", 0.2D, 256));

        List<Message> messages = prompt.getInstructions();
        Assertions.assertEquals(4, messages.size());
        Assertions.assertEquals(MessageType.SYSTEM, messages.get(0).getMessageType());
        Assertions.assertEquals(MessageType.USER, messages.get(1).getMessageType());
        Assertions.assertEquals(MessageType.ASSISTANT, messages.get(2).getMessageType());
        Assertions.assertEquals(MessageType.USER, messages.get(3).getMessageType());
        Assertions.assertEquals("Qual o lead score de maria@exemplo.com?", messages.get(3).getText());

        String system = messages.get(0).getText();
        Assertions.assertTrue(system.startsWith("Você é o agente de CRM."));
        Assertions.assertTrue(system.contains("Fatos externos:"));
        Assertions.assertTrue(system.contains("- [crm] lead_score: 87"));
        Assertions.assertTrue(system.contains("- [marketing] lookup: ERROR (timeout after 3000ms)"));

        Assertions.assertEquals("gpt-4o-mini", prompt.getOptions().getModel());
        Assertions.assertEquals(Double.valueOf(0.2D), prompt.getOptions().getTemperature());
        Assertions.assertEquals(Integer.valueOf(256), prompt.getOptions().getMaxTokens());
    }

    @Test
    public void shouldOmitFactsBlockWithoutFacts() {
        SpringAiTextCompletionGateway gateway = new SpringAiTextCompletionGateway(provider(null));
        ContextPackage greeting = new ContextPackage("u-1", "Olá", List.of(), List.of(), Map.of());

        Prompt prompt = gateway.buildPrompt(greeting, "Cumprimente o usuário.", ModelParameters.defaults());

        Assertions.assertEquals(2, prompt.getInstructions().size());
        Assertions.assertEquals("Cumprimente o usuário.", prompt.getInstructions().get(0).getText());
        Assertions.assertNull(prompt.getOptions().getModel());
    }

    @Test
    public void shouldReturnModelContent() {
        CapturingChatModel chatModel = new CapturingChatModel("O lead score de Maria é 87.");
        SpringAiTextCompletionGateway gateway = new SpringAiTextCompletionGateway(provider(chatModel));

        String text = gateway.complete(context, "Você é o agente de CRM.", ModelParameters.defaults());

        Assertions.assertEquals("O lead score de Maria é 87.", text);
        Assertions.assertNotNull(chatModel.lastPrompt);
        Assertions.assertEquals("Qual o lead score de maria@exemplo.com?", chatModel.lastPrompt.getUserMessage().getText());
    }

    @Test
    public void shouldFailWithoutChatModel() {
        SpringAiTextCompletionGateway gateway = new SpringAiTextCompletionGateway(provider(null));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> gateway.complete(context, "prompt", ModelParameters.defaults()));

        Assertions.assertTrue(ex.hasCode(ResponseCode.PROVIDER_ERROR));
    }

    @SuppressWarnings("unchecked")
    private static ObjectProvider<ChatModel> provider(ChatModel chatModel) {
        ObjectProvider<ChatModel> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(chatModel);
        return provider;
    }

    private static final class CapturingChatModel implements ChatModel {

        private final String reply;
        private volatile Prompt lastPrompt;

        private CapturingChatModel(String reply) {
            this.reply = reply;
        }

        @Override
        public ChatResponse call(Prompt prompt) {
            this.lastPrompt = prompt;
            return new ChatResponse(List.of(new Generation(new AssistantMessage(reply))));
        }
    }
}
