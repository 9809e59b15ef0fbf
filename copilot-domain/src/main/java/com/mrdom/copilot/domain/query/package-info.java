/**
 * Query 领域 - 业务记录查询域
 *
 * <p>职责：在消息被判定为业务查询时，并发调用 CRM 与营销系统连接器，并把结果规整为外部事实</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>连接器：对外部记录系统的只读查询能力，见 {@link com.mrdom.copilot.domain.query.adapter.gateway.IRecordConnector}</li>
 *   <li>外部事实：带来源标记的键值对，失败时带错误标记</li>
 *   <li>查询结果：COMPLETE / PARTIAL / DEGRADED_NO_DATA / NO_IDENTIFIER</li>
 * </ul>
 *
 * @author mrdom
 * @since 2026-10-13
 */
package com.mrdom.copilot.domain.query;
