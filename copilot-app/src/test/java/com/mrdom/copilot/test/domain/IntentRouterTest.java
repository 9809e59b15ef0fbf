package com.mrdom.copilot.test.domain;

import com.mrdom.copilot.domain.routing.model.entity.RouterRun;
import com.mrdom.copilot.domain.routing.model.valobj.RouterPolicy;
import com.mrdom.copilot.domain.routing.model.valobj.RoutingDecision;
import com.mrdom.copilot.domain.routing.service.IntentRouter;
import com.mrdom.copilot.types.enums.IntentCategoryEnum;
import com.mrdom.copilot.types.enums.RouterStateEnum;
import com.mrdom.copilot.types.enums.RoutingTieBreakEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

public class IntentRouterTest {

    private final IntentRouter router = new IntentRouter(RouterPolicy.defaults());

    @Test
    public void shouldClassifyGreeting() {
        RouterRun run = router.classify("Olá");

        Assertions.assertEquals(RouterStateEnum.CLASSIFIED, run.getState());
        RoutingDecision decision = run.getDecision();
        Assertions.assertEquals(IntentCategoryEnum.GREETING, decision.category());
        Assertions.assertEquals(new BigDecimal("0.90"), decision.confidence());
        Assertions.assertTrue(decision.signals().contains("ola"));
    }

    @Test
    public void shouldBeDeterministic() {
        String message = "Bom dia! Tudo bem?";
        RoutingDecision first = router.classify(message).getDecision();
        RoutingDecision second = router.classify(message).getDecision();

        Assertions.assertEquals(first, second);
    }

    @Test
    public void shouldClassifyDomainQueryWithEmail() {
        RoutingDecision decision = router.classify("Qual o lead score do contato maria@exemplo.com?").getDecision();

        Assertions.assertEquals(IntentCategoryEnum.DOMAIN_QUERY, decision.category());
        Assertions.assertEquals(new BigDecimal("1.00"), decision.confidence());
        Assertions.assertTrue(decision.signals().contains("email"));
        Assertions.assertTrue(decision.signals().contains("score"));
    }

    @Test
    public void shouldApplyTieBreakWhenBothSignalsMatch() {
        String message = "Oi, qual o score de maria@exemplo.com?";

        RoutingDecision domainFirst = router.classify(message).getDecision();
        Assertions.assertEquals(IntentCategoryEnum.DOMAIN_QUERY, domainFirst.category());
        Assertions.assertEquals(new BigDecimal("0.85"), domainFirst.confidence());

        IntentRouter greetingFirstRouter = new IntentRouter(RouterPolicy.defaults().withTieBreak(RoutingTieBreakEnum.GREETING_FIRST));
        RoutingDecision greetingFirst = greetingFirstRouter.classify(message).getDecision();
        Assertions.assertEquals(IntentCategoryEnum.GREETING, greetingFirst.category());
        Assertions.assertEquals(new BigDecimal("0.90"), greetingFirst.confidence());
    }

    @Test
    public void shouldReturnUnknownWithoutSignals() {
        RouterRun run = router.classify("Qual a capital da França?");

        Assertions.assertEquals(RouterStateEnum.CLASSIFIED, run.getState());
        Assertions.assertEquals(IntentCategoryEnum.UNKNOWN, run.getDecision().category());
        Assertions.assertEquals("no signal matched", run.getDecision().rationale());
        Assertions.assertEquals(0, BigDecimal.ZERO.compareTo(run.getDecision().confidence()));
    }

    @Test
    public void shouldReturnUnknownBelowConfidenceThreshold() {
        IntentRouter strict = new IntentRouter(new RouterPolicy(null, null, 0.7D, null, 0));

        RoutingDecision decision = strict.classify("qual o score?").getDecision();
        Assertions.assertEquals(IntentCategoryEnum.UNKNOWN, decision.category());
        Assertions.assertEquals("domain confidence below threshold", decision.rationale());
        Assertions.assertEquals(new BigDecimal("0.65"), decision.confidence());

        Assertions.assertEquals(IntentCategoryEnum.DOMAIN_QUERY, router.classify("qual o score?").getDecision().category());
    }

    @Test
    public void shouldFailOnInvalidInput() {
        RouterRun nullRun = router.classify(null);
        Assertions.assertTrue(nullRun.isFailed());
        Assertions.assertEquals("message is null", nullRun.getFailureReason());
        Assertions.assertEquals(IntentCategoryEnum.UNKNOWN, nullRun.effectiveDecision().category());

        Assertions.assertTrue(router.classify("   ").isFailed());

        IntentRouter shortRouter = new IntentRouter(new RouterPolicy(null, null, 0.6D, null, 10));
        RouterRun longRun = shortRouter.classify("mensagem longa demais");
        Assertions.assertTrue(longRun.isFailed());
        Assertions.assertTrue(longRun.effectiveDecision().rationale().startsWith("router failed"));
    }

    @Test
    public void shouldRejectTransitionFromTerminalState() {
        RouterRun run = router.classify("Olá");

        Assertions.assertThrows(IllegalStateException.class, () -> run.fail("late"));
        Assertions.assertThrows(IllegalStateException.class, () -> run.classify(RoutingDecision.unknown("again")));
        Assertions.assertThrows(IllegalStateException.class, () -> new RouterRun().effectiveDecision());
    }

    @Test
    public void shouldIgnoreAccentsAndCase() {
        RoutingDecision decision = router.classify("QUAL A PONTUAÇÃO DO CLIENTE?").getDecision();

        Assertions.assertEquals(IntentCategoryEnum.DOMAIN_QUERY, decision.category());
        Assertions.assertTrue(decision.signals().contains("pontuacao"));
        Assertions.assertEquals(IntentCategoryEnum.GREETING, router.classify("Obrigada!").getDecision().category());
    }
}
