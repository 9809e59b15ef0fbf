package com.mrdom.copilot.domain.query.model.valobj;

import java.time.Duration;
import java.util.List;

/**
 * 业务查询策略。
 *
 * @param timeout           单次连接器调用超时
 * @param maxRetries        失败后的最大重试次数
 * @param retryBackoff      重试间隔
 * @param crmKeywords       指向 CRM 的关键词
 * @param marketingKeywords 指向营销系统的关键词
 * @param contactKeywords   指代联系人本身的关键词
 * @param crossDomain       营销属性与联系人同时出现时是否一并查询 CRM
 */
public record QueryPolicy(Duration timeout,
                          int maxRetries,
                          Duration retryBackoff,
                          List<String> crmKeywords,
                          List<String> marketingKeywords,
                          List<String> contactKeywords,
                          boolean crossDomain) {

    public static final List<String> DEFAULT_CRM_KEYWORDS = List.of(
            "vtiger", "crm", "lead", "score", "pontuacao", "status", "telefone", "phone");
    public static final List<String> DEFAULT_MARKETING_KEYWORDS = List.of(
            "mautic", "campanha", "campaign", "segmento", "segment", "tag", "email marketing", "pontos", "points");
    public static final List<String> DEFAULT_CONTACT_KEYWORDS = List.of(
            "contato", "contact", "cliente", "customer");

    public QueryPolicy {
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofSeconds(3) : timeout;
        maxRetries = Math.max(0, maxRetries);
        retryBackoff = retryBackoff == null || retryBackoff.isNegative() ? Duration.ZERO : retryBackoff;
        crmKeywords = crmKeywords == null || crmKeywords.isEmpty() ? DEFAULT_CRM_KEYWORDS : List.copyOf(crmKeywords);
        marketingKeywords = marketingKeywords == null || marketingKeywords.isEmpty()
                ? DEFAULT_MARKETING_KEYWORDS : List.copyOf(marketingKeywords);
        contactKeywords = contactKeywords == null || contactKeywords.isEmpty()
                ? DEFAULT_CONTACT_KEYWORDS : List.copyOf(contactKeywords);
    }

    public QueryPolicy(Duration timeout, int maxRetries, Duration retryBackoff) {
        this(timeout, maxRetries, retryBackoff, null, null, null, true);
    }

    public static QueryPolicy defaults() {
        return new QueryPolicy(Duration.ofSeconds(3), 1, Duration.ofMillis(200));
    }
}
