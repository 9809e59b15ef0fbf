package com.mrdom.copilot.domain.agent.model.valobj;

import org.apache.commons.lang3.StringUtils;

import java.time.Duration;

/**
 * 应答生成策略。
 */
public record SynthesisPolicy(String greetingSystemPrompt,
                              String domainSystemPrompt,
                              ModelParameters modelParameters,
                              int maxRetries,
                              Duration retryBackoff) {

    public static final String DEFAULT_GREETING_PROMPT =
            "Você é o Mr. DOM PH Copilot, um assistente de vendas e marketing amigável. "
                    + "Cumprimente o usuário, apresente-se brevemente e explique que pode consultar contatos "
                    + "no CRM (Vtiger) e no sistema de marketing (Mautic). Responda sempre em português, "
                    + "de forma curta e cordial, usando o histórico da conversa quando existir.";

    public static final String DEFAULT_DOMAIN_PROMPT =
            "Você é o agente de CRM e marketing do Mr. DOM PH Copilot. "
                    + "Responda apenas com base nos fatos externos fornecidos no contexto. "
                    + "Nunca invente dados de contatos, pontuações, tags ou segmentos. "
                    + "Se um fato indicar lookup: NOT_FOUND, diga que o contato não foi encontrado naquele sistema. "
                    + "Responda sempre em português, de forma objetiva.";

    public SynthesisPolicy {
        greetingSystemPrompt = StringUtils.defaultIfBlank(greetingSystemPrompt, DEFAULT_GREETING_PROMPT);
        domainSystemPrompt = StringUtils.defaultIfBlank(domainSystemPrompt, DEFAULT_DOMAIN_PROMPT);
        modelParameters = modelParameters == null ? ModelParameters.defaults() : modelParameters;
        maxRetries = Math.max(0, maxRetries);
        retryBackoff = retryBackoff == null || retryBackoff.isNegative() ? Duration.ZERO : retryBackoff;
    }

    public static SynthesisPolicy defaults() {
        return new SynthesisPolicy(null, null, null, 1, Duration.ofMillis(300));
    }
}
