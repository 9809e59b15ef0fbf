/**
 * Agent 领域 - 应答生成域
 *
 * <p>职责：按 Agent 类型选择系统提示词与模型参数，调用文本生成能力，生成降级场景的固定回复</p>
 *
 * <h3>Agent</h3>
 * <ul>
 *   <li>greeting_agent - 问候与通用对话</li>
 *   <li>crm_marketing_agent - CRM 与营销数据查询</li>
 * </ul>
 *
 * @author mrdom
 * @since 2026-10-14
 */
package com.mrdom.copilot.domain.agent;
