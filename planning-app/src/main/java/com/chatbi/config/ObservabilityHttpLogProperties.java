package com.chatbi.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * HTTP 入口日志配置。
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class ObservabilityHttpLogProperties {

    /** 是否启用。 */
    private boolean enabled = true;

    /** 记录日志的路径模式。 */
    private List<String> includePathPatterns = Arrays.asList("/api/**");

    /** 排除的路径模式。 */
    private List<String> excludePathPatterns = Arrays.asList("/actuator/**");

    /** 是否记录请求体摘要。 */
    private boolean logRequestBody = true;

    /** 请求体摘要只保留这些字段。 */
    private List<String> requestBodyWhitelist = Arrays.asList("planId", "executionId", "taskId", "action", "maxSteps", "autoStart");

    /** 需要脱敏的字段名。 */
    private List<String> maskFields = Arrays.asList("authorization", "token", "secret");

    /** 慢请求阈值，超过时无论是否采样都输出。 */
    private long slowRequestThresholdMs = 1000L;

    /** 采样比例（0~1）。 */
    private double sampleRate = 1.0D;

    /** 请求体摘要最大长度。 */
    private int maxBodyLength = 512;
}
