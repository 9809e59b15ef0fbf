package com.mrdom.copilot.infrastructure.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.mrdom.copilot.domain.query.adapter.gateway.IRecordConnector;
import com.mrdom.copilot.domain.query.model.valobj.ConnectorLookupResult;
import com.mrdom.copilot.domain.query.model.valobj.ConnectorQuery;
import com.mrdom.copilot.infrastructure.util.JsonCodec;
import com.mrdom.copilot.types.common.Constants;
import com.mrdom.copilot.types.enums.ExternalSourceEnum;
import com.mrdom.copilot.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mautic 营销系统连接器。
 * <p>
 * 先用 {@code GET {base}/contacts?search=email:...&limit=1} 查询联系人，再用
 * {@code GET {base}/contacts/{id}/segments} 补充所属分群；分群查询失败时保留联系人事实，只省略 segments。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-14
 */
@Slf4j
public class MauticMarketingConnector implements IRecordConnector {

    private final RestClient restClient;
    private final JsonCodec jsonCodec;

    public MauticMarketingConnector(RestClient.Builder restClientBuilder, ConnectorSettings settings, JsonCodec jsonCodec) {
        RestClient.Builder builder = restClientBuilder.baseUrl(settings.baseUrl());
        if (settings.hasCredentials()) {
            builder.defaultHeaders(headers -> headers.setBasicAuth(settings.username(), settings.secret()));
        }
        this.restClient = builder.build();
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ExternalSourceEnum source() {
        return ExternalSourceEnum.MARKETING;
    }

    @Override
    public ConnectorLookupResult lookup(ConnectorQuery query) {
        if (query == null || StringUtils.isBlank(query.email())) {
            return ConnectorLookupResult.error("email is required for mautic lookup");
        }
        JsonNode contact;
        try {
            String body = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/contacts")
                            .queryParam("search", "{search}")
                            .queryParam("limit", 1)
                            .build("email:" + query.email()))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
            contact = firstContact(jsonCodec.readTree(body));
        } catch (RestClientException ex) {
            log.warn("MAUTIC_LOOKUP_ERROR error={}", ex.getMessage());
            return ConnectorLookupResult.error("mautic request failed: " + ex.getMessage());
        } catch (AppException ex) {
            log.warn("MAUTIC_LOOKUP_ERROR error={}", ex.getInfo());
            return ConnectorLookupResult.error("mautic response unreadable: " + ex.getInfo());
        }
        if (contact == null) {
            return ConnectorLookupResult.notFound();
        }

        Map<String, String> record = new LinkedHashMap<>();
        String contactId = jsonCodec.text(contact, "id");
        putIfPresent(record, "contact_id", contactId);
        putIfPresent(record, "email", coreField(contact, "email"));
        putIfPresent(record, "points", jsonCodec.text(contact, "points"));
        putIfPresent(record, "tags", joinNames(contact.path("tags"), "tag"));
        putIfPresent(record, "last_active", jsonCodec.text(contact, "lastActive"));
        if (contactId != null) {
            putIfPresent(record, "segments", fetchSegments(contactId));
        }
        return ConnectorLookupResult.found(record);
    }

    private JsonNode firstContact(JsonNode root) {
        JsonNode contacts = root.path("contacts");
        if (contacts.isObject() || contacts.isArray()) {
            Iterator<JsonNode> values = contacts.elements();
            if (values.hasNext()) {
                return values.next();
            }
        }
        return null;
    }

    private String fetchSegments(String contactId) {
        try {
            String body = restClient.get()
                    .uri("/contacts/{id}/segments", contactId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(String.class);
            return joinNames(jsonCodec.readTree(body).path("lists"), "name");
        } catch (RestClientException ex) {
            log.warn("MAUTIC_SEGMENTS_ERROR contactId={}, error={}", contactId, ex.getMessage());
            return null;
        } catch (AppException ex) {
            log.warn("MAUTIC_SEGMENTS_ERROR contactId={}, error={}", contactId, ex.getInfo());
            return null;
        }
    }

    private String coreField(JsonNode contact, String field) {
        JsonNode core = contact.path("fields").path("core").path(field);
        String value = jsonCodec.text(core, "value");
        if (value != null) {
            return value;
        }
        return jsonCodec.text(contact.path("fields").path("all"), field);
    }

    /**
     * 元素可以是字符串，也可以是带名称字段的对象。
     */
    private String joinNames(JsonNode node, String nameField) {
        if (!node.isContainerNode() || node.isEmpty()) {
            return null;
        }
        List<String> names = new ArrayList<>();
        Iterator<JsonNode> elements = node.elements();
        while (elements.hasNext()) {
            JsonNode element = elements.next();
            String name = element.isValueNode() ? StringUtils.trimToNull(element.asText()) : jsonCodec.text(element, nameField);
            if (name != null) {
                names.add(name);
            }
        }
        return names.isEmpty() ? null : String.join(Constants.SPLIT, names);
    }

    private static void putIfPresent(Map<String, String> record, String key, String value) {
        if (value != null) {
            record.put(key, value);
        }
    }
}
