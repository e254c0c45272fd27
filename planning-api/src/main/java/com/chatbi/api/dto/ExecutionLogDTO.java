package com.chatbi.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 执行日志 DTO。
 */
@Data
public class ExecutionLogDTO {

    private String executionId;
    private String planId;
    private String step;
    private String status;
    private String detail;
    private Map<String, Object> metadata;
    private LocalDateTime timestamp;
}
