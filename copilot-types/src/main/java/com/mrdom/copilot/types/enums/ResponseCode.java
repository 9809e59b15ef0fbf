package com.mrdom.copilot.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义 API 与管理端返回的响应码和对应描述信息。
 * </p>
 *
 * @author mrdom
 * @since 2026-10-12
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 用户标识非法 */
    INVALID_IDENTIFIER("0003", "用户标识非法"),

    /** 会话记录不存在 */
    NOT_FOUND("0004", "会话记录不存在"),

    /** 文本生成服务不可用 */
    PROVIDER_ERROR("0005", "文本生成服务不可用"),

    /** 请求超时或已取消 */
    REQUEST_TIMEOUT("0006", "请求超时");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
