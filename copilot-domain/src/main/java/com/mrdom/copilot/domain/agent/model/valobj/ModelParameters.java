package com.mrdom.copilot.domain.agent.model.valobj;

/**
 * 模型调用参数。
 *
 * @param model       模型名，为空时使用默认模型
 * @param temperature 采样温度
 * @param maxTokens   最大输出 token 数，为空时不限制
 */
public record ModelParameters(String model, Double temperature, Integer maxTokens) {

    public static ModelParameters defaults() {
        return new ModelParameters(null, 0.7D, null);
    }
}
