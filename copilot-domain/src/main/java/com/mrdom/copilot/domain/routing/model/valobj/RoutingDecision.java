package com.mrdom.copilot.domain.routing.model.valobj;

import com.mrdom.copilot.types.enums.IntentCategoryEnum;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 路由决策。每次请求独立生成，不在请求间共享。
 *
 * @param category   意图分类
 * @param confidence 置信度，[0, 1]，两位小数
 * @param rationale  决策说明
 * @param signals    命中的信号
 */
public record RoutingDecision(IntentCategoryEnum category,
                             BigDecimal confidence,
                             String rationale,
                             List<String> signals) {

    public RoutingDecision {
        if (category == null) {
            throw new IllegalStateException("Routing category cannot be null");
        }
        confidence = clamp(confidence);
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public static RoutingDecision of(IntentCategoryEnum category, double confidence, String rationale, List<String> signals) {
        return new RoutingDecision(category, BigDecimal.valueOf(confidence), rationale, signals);
    }

    public static RoutingDecision unknown(String rationale) {
        return new RoutingDecision(IntentCategoryEnum.UNKNOWN, BigDecimal.ZERO, rationale, List.of());
    }

    private static BigDecimal clamp(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        if (value.compareTo(BigDecimal.ONE) > 0) {
            return BigDecimal.ONE.setScale(2, RoundingMode.HALF_UP);
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
