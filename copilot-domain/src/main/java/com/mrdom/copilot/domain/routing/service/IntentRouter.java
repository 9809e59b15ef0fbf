package com.mrdom.copilot.domain.routing.service;

import com.mrdom.copilot.domain.routing.model.entity.RouterRun;
import com.mrdom.copilot.domain.routing.model.valobj.RouterPolicy;
import com.mrdom.copilot.domain.routing.model.valobj.RoutingDecision;
import com.mrdom.copilot.types.enums.IntentCategoryEnum;
import com.mrdom.copilot.types.enums.RoutingTieBreakEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 意图路由领域服务。
 * <p>
 * 分类只依赖消息内容与配置的模式，相同输入总是得到相同决策：
 * 仅命中问候为 GREETING；仅命中业务信号且置信度达标为 DOMAIN_QUERY；
 * 二者都命中时按 tie-break 裁决；其余为 UNKNOWN。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-13
 */
@Slf4j
@Service
public class IntentRouter {

    static final double GREETING_CONFIDENCE = 0.9D;
    static final double DOMAIN_BASE_CONFIDENCE = 0.45D;
    static final double DOMAIN_SIGNAL_WEIGHT = 0.2D;
    private static final String EMAIL_SIGNAL = "email";

    private final RouterPolicy policy;
    private final List<Pattern> greetingPatterns;
    private final List<Pattern> domainPatterns;

    public IntentRouter(RouterPolicy policy) {
        this.policy = policy == null ? RouterPolicy.defaults() : policy;
        this.greetingPatterns = MessageSignals.compileWholeWordPatterns(this.policy.greetingPatterns());
        this.domainPatterns = MessageSignals.compileKeywords(this.policy.domainKeywords());
    }

    /**
     * 执行一次路由；运行对象只属于本次调用。
     */
    public RouterRun classify(String message) {
        RouterRun run = new RouterRun();
        if (message == null) {
            run.fail("message is null");
            return run;
        }
        if (message.isBlank()) {
            run.fail("message is blank");
            return run;
        }
        if (message.length() > policy.maxMessageLength()) {
            run.fail("message longer than " + policy.maxMessageLength());
            return run;
        }
        RoutingDecision decision;
        try {
            decision = decide(message);
        } catch (RuntimeException ex) {
            log.warn("ROUTER_CLASSIFY_ERROR error={}", ex.getMessage(), ex);
            run.fail(ex.getClass().getSimpleName() + ": " + ex.getMessage());
            return run;
        }
        run.classify(decision);
        return run;
    }

    private RoutingDecision decide(String message) {
        String normalized = MessageSignals.normalize(message);
        List<String> greetingSignals = MessageSignals.matched(greetingPatterns, normalized);

        List<String> domainSignals = new ArrayList<>(MessageSignals.matched(domainPatterns, normalized));
        Optional<String> email = MessageSignals.extractEmail(message);
        if (email.isPresent()) {
            domainSignals.add(EMAIL_SIGNAL);
        }
        double domainConfidence = domainSignals.isEmpty()
                ? 0D
                : Math.min(1D, DOMAIN_BASE_CONFIDENCE + DOMAIN_SIGNAL_WEIGHT * domainSignals.size());
        boolean greeting = !greetingSignals.isEmpty();
        boolean domain = domainConfidence >= policy.minConfidence() && !domainSignals.isEmpty();

        if (greeting && domain) {
            List<String> signals = new ArrayList<>(greetingSignals);
            signals.addAll(domainSignals);
            if (policy.tieBreak() == RoutingTieBreakEnum.GREETING_FIRST) {
                return RoutingDecision.of(IntentCategoryEnum.GREETING, GREETING_CONFIDENCE,
                        "greeting and domain signals matched, greeting first", signals);
            }
            return RoutingDecision.of(IntentCategoryEnum.DOMAIN_QUERY, domainConfidence,
                    "greeting and domain signals matched, domain query first", signals);
        }
        if (domain) {
            return RoutingDecision.of(IntentCategoryEnum.DOMAIN_QUERY, domainConfidence,
                    "domain signals matched", domainSignals);
        }
        if (greeting) {
            return RoutingDecision.of(IntentCategoryEnum.GREETING, GREETING_CONFIDENCE,
                    "greeting matched", greetingSignals);
        }
        String rationale = domainSignals.isEmpty()
                ? "no signal matched"
                : "domain confidence below threshold";
        return RoutingDecision.of(IntentCategoryEnum.UNKNOWN, domainConfidence, rationale, domainSignals);
    }
}
