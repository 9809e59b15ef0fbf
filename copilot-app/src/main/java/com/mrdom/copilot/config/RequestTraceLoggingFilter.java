package com.mrdom.copilot.config;

import com.mrdom.copilot.types.common.Constants;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 统一 HTTP 链路日志过滤器：写入 traceId / requestId 到 MDC 与响应头，按采样输出 HTTP_IN / HTTP_OUT。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String HEADER_REQUEST_ID = "X-Request-Id";

    private final HttpLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(HttpLogProperties properties) {
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null || !properties.isEnabled()) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        if (includePatterns == null || includePatterns.isEmpty()) {
            return false;
        }
        return !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreate(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreate(request.getHeader(HEADER_REQUEST_ID));
        String path = normalizePath(request.getRequestURI());
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(Constants.MdcKeys.TRACE_ID, traceId);
        MDC.put(Constants.MdcKeys.REQUEST_ID, requestId);

        long startNs = System.nanoTime();
        boolean sampled = shouldSample();
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}", method, path, sanitizeQuery(request.getQueryString()));
        }

        Throwable error = null;
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean slowRequest = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            if (sampled || error != null || slowRequest) {
                String outcome = error == null ? "success" : "error";
                if (error != null || response.getStatus() >= 500) {
                    log.warn("HTTP_OUT method={}, path={}, status={}, outcome={}, costMs={}, slow={}",
                            method, path, response.getStatus(), outcome, costMs, slowRequest);
                } else {
                    log.info("HTTP_OUT method={}, path={}, status={}, outcome={}, costMs={}, slow={}",
                            method, path, response.getStatus(), outcome, costMs, slowRequest);
                }
            }
            MDC.remove(Constants.MdcKeys.TRACE_ID);
            MDC.remove(Constants.MdcKeys.REQUEST_ID);
        }
    }

    private boolean shouldSample() {
        double rate = properties.getSampleRate();
        if (rate >= 1.0D) {
            return true;
        }
        if (rate <= 0D) {
            return false;
        }
        return ThreadLocalRandom.current().nextDouble() < rate;
    }

    private String resolveOrCreate(String headerValue) {
        String value = StringUtils.trimToNull(headerValue);
        if (value == null) {
            return UUID.randomUUID().toString().replace("-", "");
        }
        return StringUtils.left(value, 64);
    }

    private String sanitizeQuery(String queryString) {
        if (StringUtils.isBlank(queryString)) {
            return "-";
        }
        List<String> sanitized = new ArrayList<>();
        for (String part : queryString.split("&")) {
            if (StringUtils.isBlank(part)) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (isMaskField(kv[0])) {
                sanitized.add(kv[0] + "=***");
            } else {
                sanitized.add(kv[0] + "=" + StringUtils.left(kv.length > 1 ? kv[1] : "", 80));
            }
        }
        return sanitized.isEmpty() ? "-" : String.join("&", sanitized);
    }

    private boolean isMaskField(String key) {
        List<String> maskFields = properties.getMaskFields();
        if (StringUtils.isBlank(key) || maskFields == null) {
            return false;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        return maskFields.stream()
                .filter(StringUtils::isNotBlank)
                .anyMatch(field -> normalized.equals(field.trim().toLowerCase(Locale.ROOT)));
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (StringUtils.isBlank(path) || patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }

    private String normalizePath(String path) {
        return StringUtils.defaultIfBlank(path, "/").trim();
    }
}
