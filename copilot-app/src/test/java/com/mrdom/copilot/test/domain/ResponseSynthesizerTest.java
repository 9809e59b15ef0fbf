package com.mrdom.copilot.test.domain;

import com.mrdom.copilot.domain.agent.model.valobj.SynthesisPolicy;
import com.mrdom.copilot.domain.agent.model.valobj.SynthesizedResponse;
import com.mrdom.copilot.domain.agent.service.ResponseSynthesizer;
import com.mrdom.copilot.domain.memory.model.valobj.ContextPackage;
import com.mrdom.copilot.domain.query.model.valobj.DomainQueryResult;
import com.mrdom.copilot.domain.query.model.valobj.ExternalFact;
import com.mrdom.copilot.test.support.ScriptedCompletionGateway;
import com.mrdom.copilot.types.enums.AgentTypeEnum;
import com.mrdom.copilot.types.enums.DomainQueryOutcomeEnum;
import com.mrdom.copilot.types.enums.ExternalSourceEnum;
import com.mrdom.copilot.types.enums.ResponseCode;
import com.mrdom.copilot.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

public class ResponseSynthesizerTest {

    private static final SynthesisPolicy FAST_RETRY = new SynthesisPolicy(null, null, null, 1, Duration.ZERO);

    private final ContextPackage context = new ContextPackage("u-1", "Olá", List.of(), List.of(), Map.of());

    @Test
    public void shouldUseGreetingPrompt() {
        ScriptedCompletionGateway gateway = new ScriptedCompletionGateway("  Olá! Sou o Mr. DOM.  ");
        ResponseSynthesizer synthesizer = new ResponseSynthesizer(gateway, FAST_RETRY);

        SynthesizedResponse response = synthesizer.synthesize(AgentTypeEnum.GREETING_AGENT, context, null);

        Assertions.assertEquals("Olá! Sou o Mr. DOM.", response.text());
        Assertions.assertEquals(SynthesisPolicy.DEFAULT_GREETING_PROMPT, gateway.lastSystemPrompt());
        Assertions.assertFalse(response.degraded());
        Assertions.assertFalse(response.fixed());
        Assertions.assertSame(context, gateway.lastContext());
    }

    @Test
    public void shouldAnswerWithoutModelWhenAllSourcesFailed() {
        ScriptedCompletionGateway gateway = new ScriptedCompletionGateway("não deveria ser chamado");
        ResponseSynthesizer synthesizer = new ResponseSynthesizer(gateway, FAST_RETRY);
        DomainQueryResult degraded = DomainQueryResult.aggregate("maria@exemplo.com",
                EnumSet.of(ExternalSourceEnum.CRM),
                Map.of(ExternalSourceEnum.CRM, List.of(ExternalFact.failure(ExternalSourceEnum.CRM, "down"))));

        SynthesizedResponse response = synthesizer.synthesize(AgentTypeEnum.CRM_MARKETING_AGENT, context, degraded);

        Assertions.assertEquals(DomainQueryOutcomeEnum.DEGRADED_NO_DATA, degraded.getOutcome());
        Assertions.assertEquals(ResponseSynthesizer.DEGRADED_REPLY, response.text());
        Assertions.assertTrue(response.degraded());
        Assertions.assertEquals(0, gateway.calls());
    }

    @Test
    public void shouldAskForEmailWithoutModel() {
        ScriptedCompletionGateway gateway = new ScriptedCompletionGateway("não deveria ser chamado");
        ResponseSynthesizer synthesizer = new ResponseSynthesizer(gateway, FAST_RETRY);

        SynthesizedResponse response = synthesizer.synthesize(AgentTypeEnum.CRM_MARKETING_AGENT, context,
                DomainQueryResult.noIdentifier(EnumSet.of(ExternalSourceEnum.CRM)));

        Assertions.assertEquals(ResponseSynthesizer.NO_IDENTIFIER_REPLY, response.text());
        Assertions.assertFalse(response.degraded());
        Assertions.assertTrue(response.fixed());
        Assertions.assertEquals(0, gateway.calls());
    }

    @Test
    public void shouldNameUnavailableSourcesOnPartialResult() {
        ScriptedCompletionGateway gateway = new ScriptedCompletionGateway("O lead score é 87; o Mautic está indisponível.");
        ResponseSynthesizer synthesizer = new ResponseSynthesizer(gateway, FAST_RETRY);
        DomainQueryResult partial = DomainQueryResult.aggregate("maria@exemplo.com",
                EnumSet.allOf(ExternalSourceEnum.class),
                Map.of(ExternalSourceEnum.CRM, List.of(ExternalFact.of(ExternalSourceEnum.CRM, "lead_score", "87")),
                        ExternalSourceEnum.MARKETING, List.of(ExternalFact.failure(ExternalSourceEnum.MARKETING, "down"))));

        synthesizer.synthesize(AgentTypeEnum.CRM_MARKETING_AGENT, context, partial);

        String prompt = gateway.lastSystemPrompt();
        Assertions.assertTrue(prompt.startsWith(SynthesisPolicy.DEFAULT_DOMAIN_PROMPT));
        Assertions.assertTrue(prompt.contains("indisponíveis nesta consulta: marketing"));
        Assertions.assertFalse(prompt.contains(": crm"));
    }

    @Test
    public void shouldRetryFailedCompletion() {
        ScriptedCompletionGateway gateway = new ScriptedCompletionGateway("Olá!")
                .then(ScriptedCompletionGateway.failing("rate limited"));
        ResponseSynthesizer synthesizer = new ResponseSynthesizer(gateway, FAST_RETRY);

        SynthesizedResponse response = synthesizer.synthesize(AgentTypeEnum.GREETING_AGENT, context, null);

        Assertions.assertEquals("Olá!", response.text());
        Assertions.assertEquals(2, gateway.calls());
    }

    @Test
    public void shouldRaiseProviderErrorWhenRetriesExhausted() {
        ScriptedCompletionGateway gateway = new ScriptedCompletionGateway(ScriptedCompletionGateway.failing("provider down"));
        ResponseSynthesizer synthesizer = new ResponseSynthesizer(gateway, FAST_RETRY);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> synthesizer.synthesize(AgentTypeEnum.GREETING_AGENT, context, null));

        Assertions.assertTrue(ex.hasCode(ResponseCode.PROVIDER_ERROR));
        Assertions.assertTrue(ex.getInfo().contains("provider down"));
        Assertions.assertEquals(2, gateway.calls());
    }

    @Test
    public void shouldTreatBlankCompletionAsFailure() {
        ScriptedCompletionGateway gateway = new ScriptedCompletionGateway("   ");
        ResponseSynthesizer synthesizer = new ResponseSynthesizer(gateway,
                new SynthesisPolicy(null, null, null, 0, Duration.ZERO));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> synthesizer.synthesize(AgentTypeEnum.GREETING_AGENT, context, null));

        Assertions.assertTrue(ex.hasCode(ResponseCode.PROVIDER_ERROR));
        Assertions.assertEquals(1, gateway.calls());
    }
}
