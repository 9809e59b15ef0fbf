package com.mrdom.copilot.trigger.application.command;

import com.mrdom.copilot.domain.agent.model.valobj.SynthesizedResponse;
import com.mrdom.copilot.domain.agent.service.ResponseSynthesizer;
import com.mrdom.copilot.domain.memory.model.valobj.CommitReceipt;
import com.mrdom.copilot.domain.memory.model.valobj.ContextPackage;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationEntry;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationExport;
import com.mrdom.copilot.domain.memory.model.valobj.ConversationSummary;
import com.mrdom.copilot.domain.memory.model.valobj.MemoryStatus;
import com.mrdom.copilot.domain.memory.service.ContextAssembler;
import com.mrdom.copilot.domain.memory.service.ConversationStore;
import com.mrdom.copilot.domain.query.model.valobj.DomainQueryResult;
import com.mrdom.copilot.domain.query.service.DomainQueryCoordinator;
import com.mrdom.copilot.domain.routing.model.entity.RouterRun;
import com.mrdom.copilot.domain.routing.model.valobj.RoutingDecision;
import com.mrdom.copilot.domain.routing.service.IntentRouter;
import com.mrdom.copilot.types.common.Constants;
import com.mrdom.copilot.types.enums.AgentTypeEnum;
import com.mrdom.copilot.types.enums.ExternalSourceEnum;
import com.mrdom.copilot.types.enums.IntentCategoryEnum;
import com.mrdom.copilot.types.enums.ResponseCode;
import com.mrdom.copilot.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 对话编排写用例：上下文组装 -> 意图路由 -> （问候 | 业务查询）-> 应答生成 -> 记忆提交。
 * <p>
 * 用户消息与助手回复在返回前一次性提交；请求超时或线程被中断时不提交任何内容。
 * 请求关闭记忆时既不读取也不写入历史。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-15
 */
@Slf4j
@Service
public class ConversationOrchestrator {

    private static final String STATUS_SUCCESS = "success";

    private final ConversationStore conversationStore;
    private final ContextAssembler contextAssembler;
    private final IntentRouter intentRouter;
    private final DomainQueryCoordinator domainQueryCoordinator;
    private final ResponseSynthesizer responseSynthesizer;
    private final Duration requestTimeout;

    private final Counter requestCounter;
    private final Counter degradedCounter;
    private final Counter connectorFailureCounter;

    public ConversationOrchestrator(ConversationStore conversationStore,
                                    ContextAssembler contextAssembler,
                                    IntentRouter intentRouter,
                                    DomainQueryCoordinator domainQueryCoordinator,
                                    ResponseSynthesizer responseSynthesizer,
                                    @Value("${copilot.request-timeout:30s}") Duration requestTimeout) {
        this.conversationStore = conversationStore;
        this.contextAssembler = contextAssembler;
        this.intentRouter = intentRouter;
        this.domainQueryCoordinator = domainQueryCoordinator;
        this.responseSynthesizer = responseSynthesizer;
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
                ? Duration.ofSeconds(30) : requestTimeout;
        this.requestCounter = Counter.builder("copilot.chat.requests.total").register(Metrics.globalRegistry);
        this.degradedCounter = Counter.builder("copilot.chat.degraded.total").register(Metrics.globalRegistry);
        this.connectorFailureCounter = Counter.builder("copilot.connector.failure.total").register(Metrics.globalRegistry);
    }

    public ConversationTurnResult process(ConversationTurnCommand command) {
        if (command == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "请求不能为空");
        }
        String userId = conversationStore.requireUserId(command.userId());
        long deadline = System.nanoTime() + requestTimeout.toNanos();
        boolean memoryEnabled = conversationStore.getPolicy().enabled() && !Boolean.FALSE.equals(command.enableMemory());
        String message = command.message();

        MDC.put(Constants.MdcKeys.USER_ID, userId);
        try {
            requestCounter.increment();
            log.info("CHAT_ACCEPTED userId={}, memoryEnabled={}, messageLength={}",
                    userId, memoryEnabled, message == null ? 0 : message.length());

            ContextPackage context = contextAssembler.prepare(userId, message, List.of(), memoryEnabled);
            RouterRun run = intentRouter.classify(message);
            if (run.isFailed()) {
                log.warn("ROUTER_FAILED userId={}, reason={}", userId, run.getFailureReason());
            }
            RoutingDecision decision = run.effectiveDecision();
            AgentTypeEnum agent = AgentTypeEnum.forCategory(decision.category());
            log.info("CHAT_ROUTED userId={}, category={}, confidence={}, agent={}, signals={}",
                    userId, decision.category(), decision.confidence(), agent.getCode(), decision.signals());

            DomainQueryResult queryResult = null;
            if (decision.category() == IntentCategoryEnum.DOMAIN_QUERY) {
                queryResult = domainQueryCoordinator.query(message);
                long errorFacts = queryResult.getErrorFactCount();
                if (errorFacts > 0) {
                    connectorFailureCounter.increment(errorFacts);
                }
                context = contextAssembler.prepare(userId, message, queryResult.getFacts(), memoryEnabled);
            }
            ensureWithinDeadline(userId, deadline);

            SynthesizedResponse response = responseSynthesizer.synthesize(agent, context, queryResult);
            if (response.degraded()) {
                degradedCounter.increment();
                log.warn("CHAT_DEGRADED userId={}, outcome={}, failedSources={}",
                        userId, queryResult == null ? null : queryResult.getOutcome(),
                        queryResult == null ? List.of() : queryResult.getFailedSources());
            }
            ensureWithinDeadline(userId, deadline);

            String conversationId = null;
            if (memoryEnabled) {
                ConversationEntry userEntry = ConversationEntry.user(StringUtils.defaultString(message),
                        userMetadata(command.context()));
                ConversationEntry assistantEntry = ConversationEntry.assistant(response.text(),
                        assistantMetadata(decision, response, queryResult, context));
                CommitReceipt receipt = conversationStore.appendAll(userId, List.of(userEntry, assistantEntry));
                conversationId = receipt.conversationId();
                log.info("CHAT_COMMITTED userId={}, conversationId={}, historySize={}, evicted={}",
                        userId, conversationId, receipt.size(), receipt.evicted());
            }

            ConversationTurnResult result = new ConversationTurnResult();
            result.setStatus(STATUS_SUCCESS);
            result.setUserId(userId);
            result.setInputMessage(message);
            result.setAgentResponse(response.text());
            result.setAgentUsed(agent.getCode());
            result.setMemoryEnabled(memoryEnabled);
            result.setConversationId(conversationId);
            result.setRoutingCategory(decision.category().getCode());
            result.setConfidence(decision.confidence());
            result.setDegraded(response.degraded());
            result.setQueryOutcome(queryResult == null ? null : queryResult.getOutcome().getCode());
            return result;
        } finally {
            MDC.remove(Constants.MdcKeys.USER_ID);
        }
    }

    public List<ConversationEntry> snapshot(String userId, int count) {
        return conversationStore.snapshot(userId, count);
    }

    public boolean clear(String userId) {
        return conversationStore.clear(userId);
    }

    public ConversationExport export(String userId, boolean allowEmpty) {
        return conversationStore.export(userId, allowEmpty);
    }

    public ConversationSummary summarize(String userId) {
        return conversationStore.summarize(userId);
    }

    public MemoryStatus status() {
        return conversationStore.status();
    }

    private void ensureWithinDeadline(String userId, long deadline) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("CHAT_ABORTED userId={}, reason=interrupted", userId);
            throw new AppException(ResponseCode.REQUEST_TIMEOUT.getCode(), "请求已取消");
        }
        if (System.nanoTime() - deadline > 0) {
            log.warn("CHAT_ABORTED userId={}, reason=deadline exceeded, timeoutMs={}", userId, requestTimeout.toMillis());
            throw new AppException(ResponseCode.REQUEST_TIMEOUT.getCode(),
                    "请求超过 " + requestTimeout.toMillis() + "ms 未完成");
        }
    }

    private Map<String, Object> userMetadata(Map<String, Object> requestContext) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (requestContext != null) {
            metadata.putAll(requestContext);
        }
        return metadata;
    }

    private Map<String, Object> assistantMetadata(RoutingDecision decision,
                                                  SynthesizedResponse response,
                                                  DomainQueryResult queryResult,
                                                  ContextPackage context) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(Constants.MetadataKeys.AGENT, response.agent().getCode());
        metadata.put(Constants.MetadataKeys.ROUTING_CATEGORY, decision.category().getCode());
        metadata.put(Constants.MetadataKeys.CONFIDENCE, decision.confidence());
        metadata.put(Constants.MetadataKeys.DEGRADED, response.degraded());
        metadata.put(Constants.MetadataKeys.CONTEXT_TRUNCATED, context.isTruncated());
        if (queryResult != null) {
            metadata.put(Constants.MetadataKeys.QUERY_OUTCOME, queryResult.getOutcome().getCode());
            metadata.put(Constants.MetadataKeys.FACT_SOURCES, queryResult.getSources().stream()
                    .map(ExternalSourceEnum::getCode)
                    .collect(Collectors.joining(Constants.SPLIT)));
        }
        return metadata;
    }

    /**
     * 单轮对话命令。
     *
     * @param userId       用户标识
     * @param message      用户消息
     * @param enableMemory 是否启用记忆，为空时按启用处理
     * @param context      渠道等附加信息，写入用户消息元数据
     */
    public record ConversationTurnCommand(String userId,
                                          String message,
                                          Boolean enableMemory,
                                          Map<String, Object> context) {
    }

    @Data
    public static class ConversationTurnResult {
        private String status;
        private String userId;
        private String inputMessage;
        private String agentResponse;
        private String agentUsed;
        private Boolean memoryEnabled;
        private String conversationId;
        private String routingCategory;
        private BigDecimal confidence;
        private Boolean degraded;
        private String queryOutcome;
    }
}
