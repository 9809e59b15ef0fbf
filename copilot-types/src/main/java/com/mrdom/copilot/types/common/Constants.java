package com.mrdom.copilot.types.common;

/**
 * 全局常量定义类。
 *
 * @author mrdom
 * @since 2026-10-12
 */
public class Constants {

    /** 逗号分隔符 */
    public final static String SPLIT = ",";

    /** 用户标识最大长度 */
    public final static int USER_ID_MAX_LENGTH = 128;

    /** 会话消息元数据键 */
    public static final class MetadataKeys {
        public static final String CHANNEL = "channel";
        public static final String AGENT = "agent";
        public static final String ROUTING_CATEGORY = "routingCategory";
        public static final String CONFIDENCE = "confidence";
        public static final String DEGRADED = "degraded";
        public static final String QUERY_OUTCOME = "queryOutcome";
        public static final String FACT_SOURCES = "factSources";
        public static final String CONTEXT_TRUNCATED = "contextTruncated";
        public static final String CONVERSATION_ID = "conversationId";

        private MetadataKeys() {
        }
    }

    /** MDC 键 */
    public static final class MdcKeys {
        public static final String TRACE_ID = "traceId";
        public static final String REQUEST_ID = "requestId";
        public static final String USER_ID = "userId";

        private MdcKeys() {
        }
    }

}
