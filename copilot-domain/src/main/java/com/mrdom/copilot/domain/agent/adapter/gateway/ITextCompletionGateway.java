package com.mrdom.copilot.domain.agent.adapter.gateway;

import com.mrdom.copilot.domain.agent.model.valobj.ModelParameters;
import com.mrdom.copilot.domain.memory.model.valobj.ContextPackage;

/**
 * 文本生成网关。失败时抛出 ResponseCode.PROVIDER_ERROR 的 AppException 或其他运行时异常。
 */
public interface ITextCompletionGateway {

    String complete(ContextPackage context, String systemPrompt, ModelParameters parameters);
}
