package com.mrdom.copilot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Copilot 业务配置，前缀 copilot。
 *
 * @author mrdom
 * @since 2026-10-15
 */
@Data
@ConfigurationProperties(prefix = "copilot", ignoreInvalidFields = true)
public class CopilotProperties {

    /** 单次请求的处理时限，超时不提交记忆 */
    private Duration requestTimeout = Duration.ofSeconds(30);

    private Memory memory = new Memory();

    private Router router = new Router();

    private Query query = new Query();

    private Completion completion = new Completion();

    private Connector connector = new Connector();

    @Data
    public static class Memory {
        /** 是否启用会话记忆 */
        private boolean enabled = true;
        /** 每个用户保留的最大消息数 */
        private int windowSize = 10;
        /** 组装上下文时读取的最近消息数 */
        private int contextEntries = 10;
        /** 上下文字符预算，小于等于 0 不限制 */
        private int contextCharBudget = 6000;
        /** OLDEST_FIRST / OLDEST_EXCHANGE_FIRST */
        private String truncationPolicy = "OLDEST_FIRST";
        /** 是否输出记忆操作日志 */
        private boolean loggingEnabled = true;
    }

    @Data
    public static class Router {
        private List<String> greetingPatterns = new ArrayList<>();
        private List<String> domainKeywords = new ArrayList<>();
        private double minConfidence = 0.6D;
        /** DOMAIN_QUERY_FIRST / GREETING_FIRST */
        private String tieBreak = "DOMAIN_QUERY_FIRST";
        private int maxMessageLength = 4000;
    }

    @Data
    public static class Query {
        private Duration timeout = Duration.ofSeconds(3);
        private int maxRetries = 1;
        private Duration retryBackoff = Duration.ofMillis(200);
        private List<String> crmKeywords = new ArrayList<>();
        private List<String> marketingKeywords = new ArrayList<>();
        /** 指代联系人本身的关键词，与营销关键词同时出现时一并查询 CRM */
        private List<String> contactKeywords = new ArrayList<>();
        private boolean crossDomain = true;
    }

    @Data
    public static class Completion {
        /** 模型名，为空时使用 spring.ai.openai.chat.options.model */
        private String model;
        private Double temperature = 0.7D;
        private Integer maxTokens;
        private int maxRetries = 1;
        private Duration retryBackoff = Duration.ofMillis(300);
        private String greetingSystemPrompt;
        private String domainSystemPrompt;
    }

    @Data
    public static class Connector {
        private Endpoint vtiger = new Endpoint();
        private Endpoint mautic = new Endpoint();
        /** 建立连接超时 */
        private Duration connectTimeout = Duration.ofSeconds(2);
        /** 读取超时 */
        private Duration readTimeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Endpoint {
        private boolean enabled = true;
        private String baseUrl;
        private String username;
        private String secret;
    }
}
