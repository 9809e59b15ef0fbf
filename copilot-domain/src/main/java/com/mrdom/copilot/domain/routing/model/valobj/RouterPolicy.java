package com.mrdom.copilot.domain.routing.model.valobj;

import com.mrdom.copilot.types.enums.RoutingTieBreakEnum;

import java.util.List;

/**
 * 路由策略。
 *
 * @param greetingPatterns  问候模式（整词匹配，可为正则片段）
 * @param domainKeywords    业务信号关键词
 * @param minConfidence     业务查询的最低置信度
 * @param tieBreak          问候与业务信号同时命中时的裁决方式
 * @param maxMessageLength  可分类的最大消息长度
 */
public record RouterPolicy(List<String> greetingPatterns,
                           List<String> domainKeywords,
                           double minConfidence,
                           RoutingTieBreakEnum tieBreak,
                           int maxMessageLength) {

    public static final List<String> DEFAULT_GREETING_PATTERNS = List.of(
            "ola", "oi", "oie", "bom dia", "boa tarde", "boa noite", "e ai", "tudo bem", "tudo bom",
            "hello", "hi", "hey", "obrigad[oa]", "valeu", "tchau", "quem e voce");
    public static final List<String> DEFAULT_DOMAIN_KEYWORDS = List.of(
            "contato", "contact", "cliente", "lead", "score", "pontuacao", "pontos", "campanha", "campaign",
            "segmento", "segment", "tag", "vtiger", "mautic", "crm");

    public RouterPolicy {
        greetingPatterns = greetingPatterns == null || greetingPatterns.isEmpty()
                ? DEFAULT_GREETING_PATTERNS : List.copyOf(greetingPatterns);
        domainKeywords = domainKeywords == null || domainKeywords.isEmpty()
                ? DEFAULT_DOMAIN_KEYWORDS : List.copyOf(domainKeywords);
        if (minConfidence < 0D || minConfidence > 1D) {
            throw new IllegalArgumentException("minConfidence must be within [0, 1]");
        }
        tieBreak = tieBreak == null ? RoutingTieBreakEnum.DOMAIN_QUERY_FIRST : tieBreak;
        maxMessageLength = maxMessageLength <= 0 ? 4000 : maxMessageLength;
    }

    public static RouterPolicy defaults() {
        return new RouterPolicy(null, null, 0.6D, RoutingTieBreakEnum.DOMAIN_QUERY_FIRST, 4000);
    }

    public RouterPolicy withTieBreak(RoutingTieBreakEnum value) {
        return new RouterPolicy(greetingPatterns, domainKeywords, minConfidence, value, maxMessageLength);
    }
}
