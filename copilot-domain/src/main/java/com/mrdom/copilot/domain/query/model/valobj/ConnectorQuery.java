package com.mrdom.copilot.domain.query.model.valobj;

/**
 * 连接器查询条件。
 *
 * @param email   联系人邮箱
 * @param message 原始消息
 */
public record ConnectorQuery(String email, String message) {
}
