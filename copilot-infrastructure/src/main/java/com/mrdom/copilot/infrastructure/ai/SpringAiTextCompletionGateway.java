package com.mrdom.copilot.infrastructure.ai;

import com.mrdom.copilot.domain.agent.adapter.gateway.ITextCompletionGateway;
import com.mrdom.copilot.domain.agent.model.valobj.ModelParameters;
import com.mrdom.copilot.domain.memory.model.valobj.ContextPackage;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationEntry;
import com.mrdom.copilot.domain.query.model.valobj.ExternalFact;
import com.mrdom.copilot.types.enums.ResponseCode;
import com.mrdom.copilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Spring AI ChatClient 的文本生成网关。
 * <p>
 * 系统提示词与外部事实合并为一条 system 消息，历史消息按角色映射为 user / assistant 消息，
 * 当前消息作为最后一条 user 消息。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-14
 */
@Slf4j
@Component
public class SpringAiTextCompletionGateway implements ITextCompletionGateway {

    private final ObjectProvider<ChatModel> chatModelProvider;
    private volatile ChatClient chatClient;

    public SpringAiTextCompletionGateway(ObjectProvider<ChatModel> chatModelProvider) {
        this.chatModelProvider = chatModelProvider;
    }

    @Override
    public String complete(ContextPackage context, String systemPrompt, ModelParameters parameters) {
        Prompt prompt = buildPrompt(context, systemPrompt, parameters);
        long startedAt = System.currentTimeMillis();
        String content = resolveClient().prompt(prompt).call().content();
        log.debug("COMPLETION_DONE userId={}, messages={}, costMs={}",
                context.userId(), prompt.getInstructions().size(), System.currentTimeMillis() - startedAt);
        return content;
    }

    public Prompt buildPrompt(ContextPackage context, String systemPrompt, ModelParameters parameters) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(buildSystemText(systemPrompt, context.facts())));
        for (ConversationEntry entry : context.history()) {
            if (entry.isAssistant()) {
                messages.add(new AssistantMessage(entry.content()));
            } else {
                messages.add(new UserMessage(entry.content()));
            }
        }
        messages.add(new UserMessage(context.currentMessage()));
        return new Prompt(messages, buildOptions(parameters));
    }

    private String buildSystemText(String systemPrompt, List<ExternalFact> facts) {
        StringBuilder text = new StringBuilder(StringUtils.defaultString(systemPrompt));
        if (facts == null || facts.isEmpty()) {
            return text.toString();
        }
        text.append("\n\nFatos externos:");
        for (ExternalFact fact : facts) {
            text.append("\n- ").append(fact.render());
        }
        return text.toString();
    }

    private ChatOptions buildOptions(ModelParameters parameters) {
        ChatOptions.Builder builder = ChatOptions.builder();
        if (parameters == null) {
            return builder.build();
        }
        if (StringUtils.isNotBlank(parameters.model())) {
            builder.model(parameters.model());
        }
        if (parameters.temperature() != null) {
            builder.temperature(parameters.temperature());
        }
        if (parameters.maxTokens() != null) {
            builder.maxTokens(parameters.maxTokens());
        }
        return builder.build();
    }

    private ChatClient resolveClient() {
        ChatClient client = chatClient;
        if (client != null) {
            return client;
        }
        synchronized (this) {
            if (chatClient == null) {
                ChatModel chatModel = chatModelProvider.getIfAvailable();
                if (chatModel == null) {
                    throw new AppException(ResponseCode.PROVIDER_ERROR.getCode(), "No ChatModel configured");
                }
                chatClient = ChatClient.builder(chatModel).build();
            }
            return chatClient;
        }
    }
}
