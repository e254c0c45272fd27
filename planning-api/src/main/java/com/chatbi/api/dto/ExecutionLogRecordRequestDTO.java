package com.chatbi.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 人工执行记录请求 DTO。
 */
@Data
public class ExecutionLogRecordRequestDTO {

    private String planId;
    private String executionId;
    private String status = "planned";
    private String note;
    private Map<String, Object> metadata;
}
