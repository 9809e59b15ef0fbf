/**
 * Memory 领域 - 会话记忆域
 *
 * <p>职责：按用户维护有界的会话历史，并为每条入站消息组装上下文包</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>窗口：每个用户最多保留 W 条消息，超出时先淘汰最旧的消息</li>
 *   <li>上下文包：最近的历史消息、当前消息与外部事实，受字符预算约束</li>
 *   <li>用户隔离：不同用户的历史互不可见，互不阻塞</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.mrdom.copilot.domain.memory.model.entity.ConversationHistory}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>ConversationStore - 会话历史的追加、快照、清理与导出</li>
 *   <li>ContextAssembler - 上下文包组装与截断</li>
 * </ul>
 *
 * @author mrdom
 * @since 2026-10-12
 */
package com.mrdom.copilot.domain.memory;
