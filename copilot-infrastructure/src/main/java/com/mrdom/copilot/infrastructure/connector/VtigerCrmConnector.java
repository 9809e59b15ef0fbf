package com.mrdom.copilot.infrastructure.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.mrdom.copilot.domain.query.adapter.gateway.IRecordConnector;
import com.mrdom.copilot.domain.query.model.valobj.ConnectorLookupResult;
import com.mrdom.copilot.domain.query.model.valobj.ConnectorQuery;
import com.mrdom.copilot.infrastructure.util.JsonCodec;
import com.mrdom.copilot.types.enums.ExternalSourceEnum;
import com.mrdom.copilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Vtiger CRM 连接器。
 * <p>
 * 通过 REST query 接口按邮箱查询联系人：{@code GET {base}/query?query=SELECT * FROM Contacts WHERE email = '...' LIMIT 1;}，
 * 使用 Basic 认证（用户名 + access key）。{@code success=false} 或 HTTP 错误视为连接器错误，空结果视为记录不存在。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-14
 */
@Slf4j
public class VtigerCrmConnector implements IRecordConnector {

    private static final String QUERY_TEMPLATE = "SELECT * FROM Contacts WHERE email = '%s' LIMIT 1;";

    private final RestClient restClient;
    private final JsonCodec jsonCodec;

    public VtigerCrmConnector(RestClient.Builder restClientBuilder, ConnectorSettings settings, JsonCodec jsonCodec) {
        RestClient.Builder builder = restClientBuilder.baseUrl(settings.baseUrl());
        if (settings.hasCredentials()) {
            builder.defaultHeaders(headers -> headers.setBasicAuth(settings.username(), settings.secret()));
        }
        this.restClient = builder.build();
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ExternalSourceEnum source() {
        return ExternalSourceEnum.CRM;
    }

    @Override
    public ConnectorLookupResult lookup(ConnectorQuery query) {
        if (query == null || StringUtils.isBlank(query.email())) {
            return ConnectorLookupResult.error("email is required for vtiger lookup");
        }
        String vql = String.format(QUERY_TEMPLATE, escape(query.email()));
        try {
            String body = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/query").queryParam("query", "{query}").build(vql))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
            return toResult(jsonCodec.readTree(body));
        } catch (RestClientException ex) {
            log.warn("VTIGER_LOOKUP_ERROR error={}", ex.getMessage());
            return ConnectorLookupResult.error("vtiger request failed: " + ex.getMessage());
        } catch (AppException ex) {
            log.warn("VTIGER_LOOKUP_ERROR error={}", ex.getInfo());
            return ConnectorLookupResult.error("vtiger response unreadable: " + ex.getInfo());
        }
    }

    private ConnectorLookupResult toResult(JsonNode root) {
        if (!root.path("success").asBoolean(false)) {
            JsonNode error = root.path("error");
            String code = jsonCodec.text(error, "code");
            String message = jsonCodec.text(error, "message");
            return ConnectorLookupResult.error("vtiger error " + StringUtils.defaultString(code, "UNKNOWN")
                    + ": " + StringUtils.defaultString(message, "no message"));
        }
        JsonNode records = root.path("result");
        if (!records.isArray() || records.isEmpty()) {
            return ConnectorLookupResult.notFound();
        }
        JsonNode contact = records.get(0);
        Map<String, String> record = new LinkedHashMap<>();
        String name = StringUtils.normalizeSpace(StringUtils.defaultString(jsonCodec.text(contact, "firstname"))
                + " " + StringUtils.defaultString(jsonCodec.text(contact, "lastname")));
        putIfPresent(record, "contact_name", StringUtils.trimToNull(name));
        putIfPresent(record, "email", jsonCodec.text(contact, "email"));
        putIfPresent(record, "phone", jsonCodec.text(contact, "phone"));
        putIfPresent(record, "lead_score", jsonCodec.text(contact, "cf_lead_score"));
        putIfPresent(record, "lead_status", jsonCodec.text(contact, "leadstatus"));
        putIfPresent(record, "last_activity", jsonCodec.text(contact, "modifiedtime"));
        putIfPresent(record, "record_id", jsonCodec.text(contact, "id"));
        return ConnectorLookupResult.found(record);
    }

    private static void putIfPresent(Map<String, String> record, String key, String value) {
        if (value != null) {
            record.put(key, value);
        }
    }

    private static String escape(String value) {
        return value.replace("'", "''");
    }
}
