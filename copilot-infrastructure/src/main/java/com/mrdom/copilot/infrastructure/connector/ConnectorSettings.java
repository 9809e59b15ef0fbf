package com.mrdom.copilot.infrastructure.connector;

import org.apache.commons.lang3.StringUtils;

/**
 * 连接器访问配置：REST 基础地址与 Basic 认证凭据。
 *
 * @param baseUrl  基础地址
 * @param username 用户名
 * @param secret   访问密钥或密码
 */
public record ConnectorSettings(String baseUrl, String username, String secret) {

    public ConnectorSettings {
        baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(baseUrl), "/");
        if (baseUrl.isEmpty()) {
            throw new IllegalArgumentException("Connector base-url is required");
        }
    }

    public boolean hasCredentials() {
        return StringUtils.isNotBlank(username) && secret != null;
    }

    @Override
    public String toString() {
        return "ConnectorSettings{baseUrl='" + baseUrl + "', username='" + username + "'}";
    }
}
