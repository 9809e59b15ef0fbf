package com.mrdom.copilot.domain.query.service;

import com.mrdom.copilot.domain.query.adapter.gateway.IRecordConnector;
import com.mrdom.copilot.domain.query.model.valobj.ConnectorLookupResult;
import com.mrdom.copilot.domain.query.model.valobj.ConnectorQuery;
import com.mrdom.copilot.domain.query.model.valobj.DomainQueryResult;
import com.mrdom.copilot.domain.query.model.valobj.ExternalFact;
import com.mrdom.copilot.domain.query.model.valobj.QueryPolicy;
import com.mrdom.copilot.domain.routing.service.MessageSignals;
import com.mrdom.copilot.types.enums.ExternalSourceEnum;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * 业务查询协调领域服务。
 * <p>
 * 根据消息确定相关的记录系统，提取联系人邮箱，在连接器线程池上并发查询，
 * 单次调用超时与失败都转为带错误标记的外部事实，失败调用按策略有限次重试。
 * 记录不存在是合法答案，不重试。连接器集合按配置启用，由应用层装配。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-13
 */
@Slf4j
public class DomainQueryCoordinator {

    private final Map<ExternalSourceEnum, IRecordConnector> connectors = new EnumMap<>(ExternalSourceEnum.class);
    private final Executor executor;
    private final QueryPolicy policy;
    private final List<Pattern> crmPatterns;
    private final List<Pattern> marketingPatterns;
    private final List<Pattern> contactPatterns;

    public DomainQueryCoordinator(List<IRecordConnector> connectors,
                                  Executor executor,
                                  QueryPolicy policy) {
        if (connectors != null) {
            for (IRecordConnector connector : connectors) {
                this.connectors.put(connector.source(), connector);
            }
        }
        this.executor = executor;
        this.policy = policy == null ? QueryPolicy.defaults() : policy;
        this.crmPatterns = MessageSignals.compileKeywords(this.policy.crmKeywords());
        this.marketingPatterns = MessageSignals.compileKeywords(this.policy.marketingKeywords());
        this.contactPatterns = MessageSignals.compileKeywords(this.policy.contactKeywords());
    }

    public DomainQueryResult query(String message) {
        Set<ExternalSourceEnum> sources = resolveSources(message);
        Optional<String> email = MessageSignals.extractEmail(message);
        if (email.isEmpty()) {
            log.info("DOMAIN_QUERY_NO_IDENTIFIER sources={}", sources);
            return DomainQueryResult.noIdentifier(sources);
        }
        ConnectorQuery query = new ConnectorQuery(email.get(), message);

        Map<ExternalSourceEnum, CompletableFuture<List<ExternalFact>>> pending = new EnumMap<>(ExternalSourceEnum.class);
        for (ExternalSourceEnum source : sources) {
            IRecordConnector connector = connectors.get(source);
            if (connector == null) {
                pending.put(source, CompletableFuture.completedFuture(
                        List.of(ExternalFact.failure(source, "connector not configured"))));
                continue;
            }
            pending.put(source, lookupWithRetry(connector, query, 0));
        }

        Map<ExternalSourceEnum, List<ExternalFact>> factsBySource = await(pending);
        DomainQueryResult result = DomainQueryResult.aggregate(email.get(), sources, factsBySource);
        log.info("DOMAIN_QUERY_DONE sources={}, outcome={}, facts={}, failedSources={}",
                sources, result.getOutcome(), result.getFacts().size(), result.getFailedSources());
        return result;
    }

    /**
     * 相关来源：命中 CRM / 营销关键词的系统；都未命中时按通用联系人查询走 CRM。
     * <p>
     * 跨域引用（如“联系人的最近一次营销活动”）同时查询两个系统：营销属性与联系人指代同时出现时补充 CRM。
     * </p>
     */
    public Set<ExternalSourceEnum> resolveSources(String message) {
        String normalized = MessageSignals.normalize(message);
        Set<ExternalSourceEnum> sources = EnumSet.noneOf(ExternalSourceEnum.class);
        if (MessageSignals.countMatches(crmPatterns, normalized) > 0) {
            sources.add(ExternalSourceEnum.CRM);
        }
        if (MessageSignals.countMatches(marketingPatterns, normalized) > 0) {
            sources.add(ExternalSourceEnum.MARKETING);
            if (policy.crossDomain() && MessageSignals.countMatches(contactPatterns, normalized) > 0) {
                sources.add(ExternalSourceEnum.CRM);
            }
        }
        if (sources.isEmpty()) {
            sources.add(ExternalSourceEnum.CRM);
        }
        return sources;
    }

    private CompletableFuture<List<ExternalFact>> lookupWithRetry(IRecordConnector connector,
                                                                  ConnectorQuery query,
                                                                  int attempt) {
        CompletableFuture<ConnectorLookupResult> call;
        try {
            call = CompletableFuture.supplyAsync(() -> connector.lookup(query), executor);
        } catch (RejectedExecutionException ex) {
            call = CompletableFuture.failedFuture(ex);
        }
        return call.orTimeout(policy.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> new Attempt(result, error))
                .thenCompose(outcome -> {
                    ExternalSourceEnum source = connector.source();
                    if (!outcome.failed()) {
                        return CompletableFuture.completedFuture(toFacts(source, outcome.result()));
                    }
                    String reason = outcome.reason(policy.timeout().toMillis());
                    if (attempt < policy.maxRetries()) {
                        log.warn("CONNECTOR_RETRY source={}, attempt={}, reason={}", source, attempt + 1, reason);
                        // 退避后由公共池重新提交，不占用 JDK 延迟调度线程
                        Executor delayed = CompletableFuture.delayedExecutor(
                                policy.retryBackoff().toMillis(), TimeUnit.MILLISECONDS);
                        return CompletableFuture.runAsync(() -> { }, delayed)
                                .thenCompose(ignored -> lookupWithRetry(connector, query, attempt + 1));
                    }
                    log.warn("CONNECTOR_LOOKUP_FAILED source={}, attempts={}, reason={}", source, attempt + 1, reason);
                    return CompletableFuture.completedFuture(List.of(ExternalFact.failure(source, reason)));
                });
    }

    private Map<ExternalSourceEnum, List<ExternalFact>> await(Map<ExternalSourceEnum, CompletableFuture<List<ExternalFact>>> pending) {
        long budgetMillis = overallBudgetMillis();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(budgetMillis);
        Map<ExternalSourceEnum, List<ExternalFact>> factsBySource = new EnumMap<>(ExternalSourceEnum.class);
        for (Map.Entry<ExternalSourceEnum, CompletableFuture<List<ExternalFact>>> item : pending.entrySet()) {
            ExternalSourceEnum source = item.getKey();
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                factsBySource.put(source, item.getValue().get(remaining, TimeUnit.NANOSECONDS));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                factsBySource.put(source, List.of(ExternalFact.failure(source, "interrupted")));
            } catch (TimeoutException ex) {
                log.warn("CONNECTOR_LOOKUP_FAILED source={}, reason=overall budget {}ms exhausted", source, budgetMillis);
                factsBySource.put(source, List.of(ExternalFact.failure(source, "timeout after " + budgetMillis + "ms")));
            } catch (ExecutionException ex) {
                log.warn("CONNECTOR_LOOKUP_FAILED source={}, reason={}", source, ex.getCause().getMessage(), ex.getCause());
                factsBySource.put(source, List.of(ExternalFact.failure(source, String.valueOf(ex.getCause().getMessage()))));
            }
        }
        return factsBySource;
    }

    private long overallBudgetMillis() {
        long attempts = policy.maxRetries() + 1L;
        return attempts * policy.timeout().toMillis() + policy.maxRetries() * policy.retryBackoff().toMillis() + 500L;
    }

    private static List<ExternalFact> toFacts(ExternalSourceEnum source, ConnectorLookupResult result) {
        if (result.status() == ConnectorLookupResult.Status.NOT_FOUND) {
            return List.of(ExternalFact.notFound(source));
        }
        List<ExternalFact> facts = new ArrayList<>();
        result.record().forEach((key, value) -> {
            if (value != null) {
                facts.add(ExternalFact.of(source, key, value));
            }
        });
        if (facts.isEmpty()) {
            return List.of(ExternalFact.notFound(source));
        }
        return facts;
    }

    private record Attempt(ConnectorLookupResult result, Throwable error) {

        boolean failed() {
            return error != null || result == null || result.isError();
        }

        String reason(long timeoutMillis) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof TimeoutException) {
                return "timeout after " + timeoutMillis + "ms";
            }
            if (cause != null) {
                return cause.getClass().getSimpleName() + ": " + cause.getMessage();
            }
            if (result == null) {
                return "connector returned no result";
            }
            return result.errorMessage() == null ? "connector error" : result.errorMessage();
        }
    }
}
