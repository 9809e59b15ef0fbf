package com.mrdom.copilot.domain.agent.model.valobj;

import com.mrdom.copilot.types.enums.AgentTypeEnum;

/**
 * 生成的应答。
 *
 * @param text     回复文本
 * @param agent    应答的 Agent
 * @param degraded 是否为缺少外部数据的降级回复
 * @param fixed    是否为未调用模型的固定回复
 */
public record SynthesizedResponse(String text, AgentTypeEnum agent, boolean degraded, boolean fixed) {
}
