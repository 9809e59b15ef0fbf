package com.mrdom.copilot.config;

import com.mrdom.copilot.domain.agent.model.valobj.ModelParameters;
import com.mrdom.copilot.domain.agent.model.valobj.SynthesisPolicy;
import com.mrdom.copilot.domain.memory.model.valobj.MemoryPolicy;
import com.mrdom.copilot.domain.query.adapter.gateway.IRecordConnector;
import com.mrdom.copilot.domain.query.model.valobj.QueryPolicy;
import com.mrdom.copilot.domain.query.service.DomainQueryCoordinator;
import com.mrdom.copilot.domain.routing.model.valobj.RouterPolicy;
import com.mrdom.copilot.types.enums.ContextTruncationPolicyEnum;
import com.mrdom.copilot.types.enums.RoutingTieBreakEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 领域策略装配：把 copilot.* 配置转换为各领域服务的策略对象。
 *
 * @author mrdom
 * @since 2026-10-15
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CopilotProperties.class)
public class CopilotDomainConfig {

    @Bean
    public MemoryPolicy memoryPolicy(CopilotProperties properties) {
        CopilotProperties.Memory memory = properties.getMemory();
        return new MemoryPolicy(memory.isEnabled(),
                memory.getWindowSize(),
                memory.getContextEntries(),
                memory.getContextCharBudget(),
                ContextTruncationPolicyEnum.fromText(memory.getTruncationPolicy()),
                memory.isLoggingEnabled());
    }

    @Bean
    public RouterPolicy routerPolicy(CopilotProperties properties) {
        CopilotProperties.Router router = properties.getRouter();
        return new RouterPolicy(router.getGreetingPatterns(),
                router.getDomainKeywords(),
                router.getMinConfidence(),
                RoutingTieBreakEnum.fromText(router.getTieBreak()),
                router.getMaxMessageLength());
    }

    @Bean
    public QueryPolicy queryPolicy(CopilotProperties properties) {
        CopilotProperties.Query query = properties.getQuery();
        return new QueryPolicy(query.getTimeout(),
                query.getMaxRetries(),
                query.getRetryBackoff(),
                query.getCrmKeywords(),
                query.getMarketingKeywords(),
                query.getContactKeywords(),
                query.isCrossDomain());
    }

    @Bean
    public SynthesisPolicy synthesisPolicy(CopilotProperties properties) {
        CopilotProperties.Completion completion = properties.getCompletion();
        return new SynthesisPolicy(completion.getGreetingSystemPrompt(),
                completion.getDomainSystemPrompt(),
                new ModelParameters(completion.getModel(), completion.getTemperature(), completion.getMaxTokens()),
                completion.getMaxRetries(),
                completion.getRetryBackoff());
    }

    @Bean
    public DomainQueryCoordinator domainQueryCoordinator(ObjectProvider<IRecordConnector> connectors,
                                                         @Qualifier("connectorLookupExecutor") Executor connectorLookupExecutor,
                                                         QueryPolicy queryPolicy) {
        List<IRecordConnector> enabled = connectors.orderedStream().collect(Collectors.toList());
        log.info("Domain query connectors: {}", enabled.stream().map(IRecordConnector::source).collect(Collectors.toList()));
        return new DomainQueryCoordinator(enabled, connectorLookupExecutor, queryPolicy);
    }
}
