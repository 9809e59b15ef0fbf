/**
 * Routing 领域 - 意图路由域
 *
 * <p>职责：对入站消息做一次性分类（问候 / 业务查询 / 未知），选择应答的 Agent</p>
 *
 * <h3>状态机</h3>
 * <ul>
 *   <li>START -> CLASSIFIED（终态）</li>
 *   <li>START -> FAILED（终态），编排层按 UNKNOWN 处理</li>
 * </ul>
 *
 * @author mrdom
 * @since 2026-10-13
 */
package com.mrdom.copilot.domain.routing;
