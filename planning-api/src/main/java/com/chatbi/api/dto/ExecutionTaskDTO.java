package com.chatbi.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 执行任务 DTO。
 */
@Data
public class ExecutionTaskDTO {

    private String taskId;
    private String title;
    private String assignedAgent;
    private List<String> dependsOn;
    private Map<String, Boolean> toolchain;
    private String status;
    private Integer attempts;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private String outputSummary;
    private String error;
}
