package com.chatbi.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 执行实例详情 DTO。
 */
@Data
public class ExecutionDetailDTO {

    private String executionId;
    private String planId;
    private String question;
    private String scene;
    private String category;
    private String workflowMode;
    private String state;
    private Boolean autoStart;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private List<ExecutionTaskDTO> tasks;
    private String resultSummary;
}
