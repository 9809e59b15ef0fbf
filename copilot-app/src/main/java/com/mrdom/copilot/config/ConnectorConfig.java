package com.mrdom.copilot.config;

import com.mrdom.copilot.domain.query.adapter.gateway.IRecordConnector;
import com.mrdom.copilot.infrastructure.connector.ConnectorSettings;
import com.mrdom.copilot.infrastructure.connector.MauticMarketingConnector;
import com.mrdom.copilot.infrastructure.connector.VtigerCrmConnector;
import com.mrdom.copilot.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * 外部记录系统连接器装配。
 * <p>
 * 每个连接器使用独立的 RestClient，连接与读取超时来自 copilot.connector.*；
 * copilot.connector.{vtiger|mautic}.enabled=false 时不注册对应连接器。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-15
 */
@Slf4j
@Configuration
public class ConnectorConfig {

    @Bean
    @ConditionalOnProperty(prefix = "copilot.connector.vtiger", name = "enabled", havingValue = "true", matchIfMissing = true)
    public IRecordConnector vtigerCrmConnector(CopilotProperties properties, JsonCodec jsonCodec) {
        CopilotProperties.Endpoint endpoint = properties.getConnector().getVtiger();
        ConnectorSettings settings = new ConnectorSettings(endpoint.getBaseUrl(), endpoint.getUsername(), endpoint.getSecret());
        log.info("Vtiger connector enabled: {}", settings);
        return new VtigerCrmConnector(restClientBuilder(properties), settings, jsonCodec);
    }

    @Bean
    @ConditionalOnProperty(prefix = "copilot.connector.mautic", name = "enabled", havingValue = "true", matchIfMissing = true)
    public IRecordConnector mauticMarketingConnector(CopilotProperties properties, JsonCodec jsonCodec) {
        CopilotProperties.Endpoint endpoint = properties.getConnector().getMautic();
        ConnectorSettings settings = new ConnectorSettings(endpoint.getBaseUrl(), endpoint.getUsername(), endpoint.getSecret());
        log.info("Mautic connector enabled: {}", settings);
        return new MauticMarketingConnector(restClientBuilder(properties), settings, jsonCodec);
    }

    private RestClient.Builder restClientBuilder(CopilotProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnector().getConnectTimeout());
        requestFactory.setReadTimeout(properties.getConnector().getReadTimeout());
        return RestClient.builder().requestFactory(requestFactory);
    }
}
