package com.mrdom.copilot.domain.agent.service;

import com.mrdom.copilot.domain.agent.adapter.gateway.ITextCompletionGateway;
import com.mrdom.copilot.domain.agent.model.valobj.SynthesisPolicy;
import com.mrdom.copilot.domain.agent.model.valobj.SynthesizedResponse;
import com.mrdom.copilot.domain.memory.model.valobj.ContextPackage;
import com.mrdom.copilot.domain.query.model.valobj.DomainQueryResult;
import com.mrdom.copilot.types.enums.AgentTypeEnum;
import com.mrdom.copilot.types.enums.DomainQueryOutcomeEnum;
import com.mrdom.copilot.types.enums.ExternalSourceEnum;
import com.mrdom.copilot.types.enums.ResponseCode;
import com.mrdom.copilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 应答生成领域服务。
 * <p>
 * 外部数据全部缺失时返回固定致歉，缺少联系人邮箱时返回固定追问，两种情况都不调用模型；
 * 其余情况按 Agent 选择系统提示词调用文本生成，失败时有限次重试，最终失败抛出 PROVIDER_ERROR。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-14
 */
@Slf4j
@Service
public class ResponseSynthesizer {

    public static final String DEGRADED_REPLY =
            "Desculpe, não consegui acessar os sistemas de CRM e marketing agora, "
                    + "então não tenho dados confiáveis para responder. Tente novamente em alguns instantes.";
    public static final String NO_IDENTIFIER_REPLY =
            "Para consultar os dados do contato, por favor informe o e-mail dele.";
    public static final String PROVIDER_FAILURE_REPLY =
            "Desculpe, não consegui processar sua mensagem agora. Tente novamente em instantes.";

    private final ITextCompletionGateway textCompletionGateway;
    private final SynthesisPolicy policy;

    public ResponseSynthesizer(ITextCompletionGateway textCompletionGateway, SynthesisPolicy policy) {
        this.textCompletionGateway = textCompletionGateway;
        this.policy = policy == null ? SynthesisPolicy.defaults() : policy;
    }

    public SynthesizedResponse synthesize(AgentTypeEnum agent, ContextPackage context, DomainQueryResult queryResult) {
        if (agent == null || context == null) {
            throw new IllegalStateException("Agent and context are required for synthesis");
        }
        if (agent == AgentTypeEnum.CRM_MARKETING_AGENT && queryResult != null) {
            if (queryResult.getOutcome() == DomainQueryOutcomeEnum.DEGRADED_NO_DATA) {
                return new SynthesizedResponse(DEGRADED_REPLY, agent, true, true);
            }
            if (queryResult.getOutcome() == DomainQueryOutcomeEnum.NO_IDENTIFIER) {
                return new SynthesizedResponse(NO_IDENTIFIER_REPLY, agent, false, true);
            }
        }
        String systemPrompt = resolveSystemPrompt(agent, queryResult);
        String text = completeWithRetry(context, systemPrompt);
        return new SynthesizedResponse(text, agent, false, false);
    }

    String resolveSystemPrompt(AgentTypeEnum agent, DomainQueryResult queryResult) {
        if (agent == AgentTypeEnum.GREETING_AGENT) {
            return policy.greetingSystemPrompt();
        }
        if (queryResult == null || queryResult.getOutcome() != DomainQueryOutcomeEnum.PARTIAL) {
            return policy.domainSystemPrompt();
        }
        List<ExternalSourceEnum> failed = queryResult.getFailedSources();
        String names = failed.stream().map(ExternalSourceEnum::getCode).collect(Collectors.joining(", "));
        return policy.domainSystemPrompt()
                + " Atenção: os seguintes sistemas estavam indisponíveis nesta consulta: " + names
                + ". Informe ao usuário que a resposta está incompleta e não suponha valores para esses sistemas.";
    }

    private String completeWithRetry(ContextPackage context, String systemPrompt) {
        int maxAttempts = policy.maxRetries() + 1;
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String text = textCompletionGateway.complete(context, systemPrompt, policy.modelParameters());
                if (StringUtils.isNotBlank(text)) {
                    return text.trim();
                }
                lastError = new IllegalStateException("empty completion");
            } catch (RuntimeException ex) {
                lastError = ex;
            }
            log.warn("COMPLETION_FAILED attempt={}/{}, userId={}, error={}",
                    attempt, maxAttempts, context.userId(), lastError.getMessage());
            if (attempt < maxAttempts) {
                sleepBackoff();
            }
        }
        throw new AppException(ResponseCode.PROVIDER_ERROR.getCode(),
                ResponseCode.PROVIDER_ERROR.getInfo() + ": " + lastError.getMessage(), lastError);
    }

    private void sleepBackoff() {
        long millis = policy.retryBackoff().toMillis();
        if (millis <= 0L) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.REQUEST_TIMEOUT.getCode(), "请求已取消", ex);
        }
    }
}
