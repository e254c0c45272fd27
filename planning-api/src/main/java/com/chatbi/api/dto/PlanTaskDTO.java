package com.chatbi.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 计划任务 DTO。
 */
@Data
public class PlanTaskDTO {

    private String taskId;
    private String title;
    private String objective;
    private String assignedAgent;
    private List<String> dependsOn;
    private Map<String, Boolean> toolchain;
}
