package com.mrdom.copilot.domain.query.adapter.gateway;

import com.mrdom.copilot.domain.query.model.valobj.ConnectorLookupResult;
import com.mrdom.copilot.domain.query.model.valobj.ConnectorQuery;
import com.mrdom.copilot.types.enums.ExternalSourceEnum;

/**
 * 外部记录系统连接器（只读）。
 * <p>
 * 实现方把传输层失败表示为 {@link ConnectorLookupResult#error(String)}，记录不存在表示为
 * {@link ConnectorLookupResult#notFound()}；抛出的异常同样按失败处理。
 * </p>
 */
public interface IRecordConnector {

    ExternalSourceEnum source();

    ConnectorLookupResult lookup(ConnectorQuery query);
}
