package com.promptroute.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 统一 HTTP 链路日志过滤器。
 * <p>
 * 为每个请求写入 MDC traceId / requestId，输出 HTTP_IN / HTTP_OUT 日志。
 * 请求体只按白名单字段摘要，Prompt 原文不会进入日志。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper objectMapper;
    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher;

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     ObservabilityHttpLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.pathMatcher = new AntPathMatcher();
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
        String traceId = resolveOrCreateHeader(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreateHeader(request.getHeader(HEADER_REQUEST_ID));
        String path = normalizePath(request.getRequestURI());
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        long startNs = System.nanoTime();
        boolean sampled = shouldSample();
        ContentCachingRequestWrapper requestWrapper = request instanceof ContentCachingRequestWrapper cachedRequest
                ? cachedRequest
                : new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper cachedResponse
                ? cachedResponse
                : new ContentCachingResponseWrapper(response);

        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}", method, path,
                    StringUtils.defaultIfBlank(truncate(request.getQueryString(), 200), "-"));
        }
        Throwable error = null;
        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean slowRequest = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            if (sampled || error != null || slowRequest) {
                String responseCode = StringUtils.defaultIfBlank(extractResponseCode(responseWrapper), "-");
                if (error == null) {
                    log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, requestBodySummary={}",
                            method, path, responseWrapper.getStatus(), responseCode, costMs,
                            extractRequestBodySummary(requestWrapper));
                } else {
                    log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, errorType={}, errorMessage={}",
                            method, path, responseWrapper.getStatus(), responseCode, costMs,
                            error.getClass().getSimpleName(), truncate(error.getMessage(), 200));
                }
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveOrCreateHeader(String value) {
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private boolean shouldSample() {
        double rate = properties.getSampleRate();
        if (rate <= 0D) {
            return false;
        }
        if (rate >= 1D) {
            return true;
        }
        return ThreadLocalRandom.current().nextDouble() <= rate;
    }

    private String extractResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        if (body.length == 0 || !isJson(responseWrapper.getContentType())) {
            return null;
        }
        try {
            Object code = objectMapper.readValue(body, MAP_REF).get("code");
            return code == null ? null : String.valueOf(code);
        } catch (IOException ex) {
            log.debug("Response body is not a json envelope: {}", ex.getMessage());
            return null;
        }
    }

    private String extractRequestBodySummary(ContentCachingRequestWrapper requestWrapper) {
        if (!properties.isLogRequestBody()) {
            return "-";
        }
        byte[] body = requestWrapper.getContentAsByteArray();
        if (body.length == 0 || !isJson(requestWrapper.getContentType())) {
            return "-";
        }
        try {
            Map<String, Object> source = objectMapper.readValue(body, MAP_REF);
            Map<String, Object> summary = new LinkedHashMap<>();
            List<String> whitelist = properties.getRequestBodyWhitelist();
            if (whitelist != null) {
                for (String key : whitelist) {
                    if (StringUtils.isNotBlank(key) && source.containsKey(key)) {
                        summary.put(key, source.get(key));
                    }
                }
            }
            if (summary.isEmpty()) {
                return "-";
            }
            return truncate(objectMapper.writeValueAsString(summary), Math.max(64, properties.getMaxBodyLength()));
        } catch (IOException ex) {
            return "-";
        }
    }

    private boolean isJson(String contentType) {
        return StringUtils.isNotBlank(contentType)
                && contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE);
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

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
