package com.chatbi.config;

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
 * HTTP 链路日志过滤器：透传或生成 X-Trace-Id / X-Request-Id，写入 MDC，并输出 HTTP_IN / HTTP_OUT。
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
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     ObservabilityHttpLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includes = properties.getIncludePathPatterns();
        return includes != null && !includes.isEmpty() && !matchesAny(path, includes);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = headerOrNewId(request.getHeader(HEADER_TRACE_ID));
        String requestId = headerOrNewId(request.getHeader(HEADER_REQUEST_ID));
        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        String method = request.getMethod();
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        boolean sampled = sampled();
        long startNs = System.nanoTime();

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}", method, path,
                    StringUtils.defaultIfBlank(request.getQueryString(), "-"));
        }

        Exception failure = null;
        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } catch (ServletException | IOException | RuntimeException ex) {
            failure = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean slow = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            if (failure != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method, path, responseWrapper.getStatus(), costMs,
                        failure.getClass().getSimpleName(),
                        StringUtils.abbreviate(failure.getMessage(), "", 200));
            } else if (sampled || slow) {
                log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, outcome=success, requestBodySummary={}",
                        method, path, responseWrapper.getStatus(),
                        StringUtils.defaultIfBlank(responseCode(responseWrapper), "-"),
                        costMs,
                        requestBodySummary(requestWrapper));
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String headerOrNewId(String value) {
        return StringUtils.isNotBlank(value) ? value.trim() : UUID.randomUUID().toString().replace("-", "");
    }

    private boolean sampled() {
        double rate = properties.getSampleRate();
        if (rate <= 0D) {
            return false;
        }
        return rate >= 1D || ThreadLocalRandom.current().nextDouble() <= rate;
    }

    private String responseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        if (body.length == 0 || !isJson(responseWrapper.getContentType())) {
            return null;
        }
        try {
            Object code = objectMapper.readValue(body, MAP_REF).get("code");
            return code == null ? null : String.valueOf(code);
        } catch (IOException ex) {
            log.debug("HTTP_OUT response body is not an envelope: {}", ex.getMessage());
            return null;
        }
    }

    /**
     * 只输出白名单字段，脱敏字段替换为 ***。
     */
    private String requestBodySummary(ContentCachingRequestWrapper requestWrapper) {
        byte[] body = requestWrapper.getContentAsByteArray();
        if (!properties.isLogRequestBody() || body.length == 0 || !isJson(requestWrapper.getContentType())) {
            return "-";
        }
        try {
            Map<String, Object> source = objectMapper.readValue(body, MAP_REF);
            Map<String, Object> summary = new LinkedHashMap<>();
            for (String key : properties.getRequestBodyWhitelist()) {
                if (source.containsKey(key)) {
                    summary.put(key, isMasked(key) ? "***" : source.get(key));
                }
            }
            if (summary.isEmpty()) {
                return "-";
            }
            return StringUtils.abbreviate(objectMapper.writeValueAsString(summary), "",
                    Math.max(64, properties.getMaxBodyLength()));
        } catch (IOException ex) {
            return "-";
        }
    }

    private boolean isMasked(String key) {
        List<String> maskFields = properties.getMaskFields();
        if (maskFields == null) {
            return false;
        }
        String normalized = key.toLowerCase(Locale.ROOT);
        return maskFields.stream().anyMatch(field -> normalized.equals(field.toLowerCase(Locale.ROOT)));
    }

    private boolean isJson(String contentType) {
        return StringUtils.isNotBlank(contentType)
                && contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE);
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }
}
